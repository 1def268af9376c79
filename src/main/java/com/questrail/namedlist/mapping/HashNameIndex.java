package com.questrail.namedlist.mapping;

import java.util.*;

/**
 * HashNameIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link NameIndex} implementation backed by a
 * {@link HashMap} from name to position.
 *
 * {@link HashMap} exposes no capacity controls after construction, so
 * {@link #reserve(int)} and {@link #compact()} rebuild the table at the
 * requested size. Rebuilds copy every binding and are O(n); they are only
 * triggered by explicit capacity calls.
 *
 * This is the default index used by {@code NamedList}.
 */
public final class HashNameIndex implements NameIndex
{
    public static final float DEFAULT_LOAD_FACTOR = 0.75f;

    private final float loadFactor;
    private HashMap<String, Integer> positionByName;
    private int reserved;

    public HashNameIndex() {
        this(0, DEFAULT_LOAD_FACTOR);
    }

    /**
     * Creates an index sized for {@code expectedSize} names.
     *
     * @param expectedSize number of names to accommodate without rehashing
     * @param loadFactor   hash table load factor
     */
    public HashNameIndex(int expectedSize, float loadFactor) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must not be negative: " + expectedSize);
        }
        if (loadFactor <= 0 || Float.isNaN(loadFactor) || Float.isInfinite(loadFactor)) {
            throw new IllegalArgumentException("Illegal load factor: " + loadFactor);
        }
        this.loadFactor = loadFactor;
        this.positionByName = new HashMap<>(tableSizeFor(expectedSize), loadFactor);
        this.reserved = expectedSize;
    }

    @Override
    public int size() {
        return positionByName.size();
    }

    @Override
    public OptionalInt positionOf(String name) {
        Objects.requireNonNull(name, "name");
        Integer position = positionByName.get(name);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    @Override
    public void bind(String name, int position) {
        Objects.requireNonNull(name, "name");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
        positionByName.put(name, position);
    }

    @Override
    public OptionalInt unbind(String name) {
        Objects.requireNonNull(name, "name");
        Integer prev = positionByName.remove(name);
        return prev == null ? OptionalInt.empty() : OptionalInt.of(prev);
    }

    @Override
    public void clear() {
        positionByName.clear();
    }

    @Override
    public void reserve(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must not be negative: " + expectedSize);
        }
        if (expectedSize <= Math.max(reserved, positionByName.size())) {
            return;
        }
        rebuild(expectedSize);
    }

    @Override
    public void compact() {
        rebuild(positionByName.size());
    }

    @Override
    public String toString() {
        return positionByName.toString();
    }

    private void rebuild(int expectedSize) {
        HashMap<String, Integer> resized = new HashMap<>(tableSizeFor(expectedSize), loadFactor);
        resized.putAll(positionByName);
        this.positionByName = resized;
        this.reserved = expectedSize;
    }

    private int tableSizeFor(int expectedSize) {
        double needed = Math.ceil(expectedSize / (double) loadFactor);
        return needed >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) needed;
    }
}
