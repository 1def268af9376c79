package com.questrail.namedlist.core;

import com.questrail.namedlist.api.Lookup;
import com.questrail.namedlist.api.Named;
import com.questrail.namedlist.mapping.HashNameIndex;
import com.questrail.namedlist.mapping.NameIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * NamedList
 * -----------------------------------------------------------------------------
 * An ordered sequence of {@link Named} elements that can also be looked up in
 * constant time by name.
 *
 * <h2>Internal Representation</h2>
 * Two structures are maintained side by side:
 * <ul>
 *   <li>{@code elements} – an array holding the sequence, positions {@code 0..size-1}</li>
 *   <li>{@code index}    – a {@link NameIndex} from name to current position</li>
 * </ul>
 *
 * After every public method returns, the element at each position {@code i}
 * has its name bound to {@code i} in the index, and the index holds no other
 * names. Every method that moves, adds or removes an element updates both
 * structures; nothing else can reach them.
 *
 * <h2>Names</h2>
 * Names are unique. {@link #push(Named)} is an upsert: an element whose name is
 * already present replaces the existing element at its position.
 * <p>
 * Elements must not change their reported name while held by the list. This
 * is not checked on every call; {@link #assertConsistent()} can detect it after
 * the fact.
 *
 * <h2>Absence vs Misuse</h2>
 * <ul>
 *   <li>Lookup misses and popping an empty list return an empty {@link Optional}</li>
 *   <li>{@link #swap(Lookup, Lookup)} and the {@code require} accessors throw
 *       when a key does not resolve</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * This class is mutable and makes no thread-safety guarantees. Iterators are
 * fail-fast on a best-effort basis. Views returned by the slice accessors must
 * not be retained across a mutating call.
 *
 * @param <T> element type
 */
public final class NamedList<T extends Named> implements Iterable<T>
{
    private static final Logger log = LoggerFactory.getLogger(NamedList.class);

    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final NameIndex index;
    private T[] elements;
    private int size;
    private int modCount;

    /**
     * Creates an empty list. Storage is allocated on first insertion.
     */
    public NamedList() {
        this.index = new HashNameIndex();
        this.elements = newArray(0);
    }

    /**
     * Creates an empty list able to hold {@code capacity} elements without
     * reallocating. A capacity of 0 allocates nothing.
     *
     * @param capacity number of elements to pre-size for
     * @throws IllegalArgumentException if {@code capacity} is negative
     */
    public NamedList(int capacity) {
        this(NamedListConfig.builder().withInitialCapacity(capacity).build());
    }

    /**
     * Creates an empty list sized and tuned by {@code config}.
     */
    public NamedList(NamedListConfig config) {
        Objects.requireNonNull(config, "config");
        int capacity = config.initialCapacity();
        this.index = new HashNameIndex(capacity, config.indexLoadFactor());
        this.elements = newArray(capacity);
    }

    public static <T extends Named> NamedList<T> withCapacity(int capacity) {
        return new NamedList<>(capacity);
    }

    /**
     * Builds a list by pushing each element in order. Later elements replace
     * earlier ones with the same name, keeping the earlier position.
     */
    @SafeVarargs
    public static <T extends Named> NamedList<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements");
        NamedList<T> list = new NamedList<>(elements.length);
        for (T element : elements) {
            list.push(element);
        }
        return list;
    }

    /**
     * Builds a list by pushing each element of {@code source} in iteration order.
     *
     * @see #of(Named[])
     */
    public static <T extends Named> NamedList<T> copyOf(Iterable<? extends T> source) {
        Objects.requireNonNull(source, "source");
        NamedList<T> list = source instanceof Collection<?> c
                ? new NamedList<>(c.size())
                : new NamedList<>();
        for (T element : source) {
            list.push(element);
        }
        return list;
    }

    // -------------------------------------------------------------------------
    // Mutation
    // -------------------------------------------------------------------------

    /**
     * Appends {@code element} to the back of the list, or replaces the element
     * with the same name if one exists. A replaced element keeps its position.
     *
     * @param element element to insert
     * @return the replaced element, or empty if {@code element} was appended
     * @throws IllegalArgumentException if the element's name is null or empty
     */
    public Optional<T> push(T element) {
        Objects.requireNonNull(element, "element");
        String name = nameOf(element);

        OptionalInt existing = index.positionOf(name);
        if (existing.isPresent()) {
            int position = existing.getAsInt();
            T replaced = elementAt(position);
            elements[position] = element;
            return Optional.of(replaced);
        }

        ensureCapacity(size + 1);
        index.bind(name, size);
        elements[size++] = element;
        modCount++;
        return Optional.empty();
    }

    /**
     * Removes the last element and returns it, or returns empty if the list is
     * empty.
     */
    public Optional<T> pop() {
        if (size == 0) {
            return Optional.empty();
        }
        T last = elementAt(size - 1);
        elements[--size] = null;
        index.unbind(last.name());
        modCount++;
        return Optional.of(last);
    }

    /**
     * Keeps the first {@code len} elements and drops the rest. Has no effect
     * if {@code len} is greater than or equal to the current size.
     *
     * @param len number of elements to keep
     * @throws IllegalArgumentException if {@code len} is negative
     */
    public void truncate(int len) {
        if (len < 0) {
            throw new IllegalArgumentException("len must not be negative: " + len);
        }
        if (len >= size) {
            return;
        }

        // Every dropped position is unbound by name; the range comes from size, not the index.
        for (int i = len; i < size; i++) {
            index.unbind(elementAt(i).name());
            elements[i] = null;
        }
        log.trace("Truncated from {} to {} elements", size, len);
        size = len;
        modCount++;
    }

    /**
     * Removes all elements. Capacity is retained.
     */
    public void clear() {
        Arrays.fill(elements, 0, size, null);
        index.clear();
        size = 0;
        modCount++;
    }

    /**
     * Swaps the elements addressed by two keys.
     * <p>
     * Both keys are resolved before anything is changed. If they resolve to
     * the same position this is a no-op.
     *
     * @throws NoSuchElementException    if a name key is unknown
     * @throws IndexOutOfBoundsException if a position key is out of range
     */
    public void swap(Lookup first, Lookup second) {
        swapPositions(requirePosition(first), requirePosition(second));
    }

    public void swap(String first, String second) {
        swapPositions(requirePosition(first), requirePosition(second));
    }

    public void swap(int first, int second) {
        swapPositions(requirePosition(first), requirePosition(second));
    }

    public void swap(String first, int second) {
        swapPositions(requirePosition(first), requirePosition(second));
    }

    public void swap(int first, String second) {
        swapPositions(requirePosition(first), requirePosition(second));
    }

    /**
     * Replaces the element addressed by {@code key} with the result of
     * applying {@code replacement} to it. The replacement must report the same
     * name as the element it replaces.
     *
     * @return the previous element, or empty if {@code key} does not resolve
     *         (in which case {@code replacement} is not invoked)
     * @throws IllegalArgumentException if the replacement's name differs
     */
    public Optional<T> update(Lookup key, UnaryOperator<T> replacement) {
        return updateAt(resolve(key), replacement);
    }

    public Optional<T> update(String name, UnaryOperator<T> replacement) {
        return updateAt(resolve(name), replacement);
    }

    public Optional<T> update(int position, UnaryOperator<T> replacement) {
        return updateAt(resolve(position), replacement);
    }

    // -------------------------------------------------------------------------
    // Lookup
    // -------------------------------------------------------------------------

    /**
     * Returns the element addressed by {@code key}.
     * <p>
     * The returned element is the stored instance, not a copy; it may be
     * mutated in place as long as its name does not change.
     *
     * @return the element, or empty if the name is unknown or the position is
     *         out of range
     */
    public Optional<T> get(Lookup key) {
        return optionalAt(resolve(key));
    }

    public Optional<T> get(String name) {
        return optionalAt(resolve(name));
    }

    public Optional<T> get(int position) {
        return optionalAt(resolve(position));
    }

    /**
     * Returns the element addressed by {@code key}, failing if there is none.
     *
     * @throws NoSuchElementException    if a name key is unknown
     * @throws IndexOutOfBoundsException if a position key is out of range
     */
    public T require(Lookup key) {
        return elementAt(requirePosition(key));
    }

    public T require(String name) {
        return elementAt(requirePosition(name));
    }

    public T require(int position) {
        return elementAt(requirePosition(position));
    }

    /**
     * Returns the current position of the element named {@code name}.
     */
    public OptionalInt positionOf(String name) {
        return index.positionOf(Objects.requireNonNull(name, "name"));
    }

    public boolean contains(String name) {
        return index.contains(Objects.requireNonNull(name, "name"));
    }

    /**
     * Returns the names of all elements, in position order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            names.add(elementAt(i).name());
        }
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // -------------------------------------------------------------------------
    // Range views
    // -------------------------------------------------------------------------

    /**
     * Returns a read-only view of positions {@code from} (inclusive) to
     * {@code to} (exclusive).
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= from <= to <= size()}
     */
    public List<T> slice(int from, int to) {
        Objects.checkFromToIndex(from, to, size);
        return Collections.unmodifiableList(Arrays.asList(elements).subList(from, to));
    }

    public List<T> sliceFrom(int from) {
        return slice(from, size);
    }

    public List<T> sliceTo(int to) {
        return slice(0, to);
    }

    public List<T> asList() {
        return slice(0, size);
    }

    @Override
    public Iterator<T> iterator() {
        return new Itr();
    }

    public Stream<T> stream() {
        return asList().stream();
    }

    // -------------------------------------------------------------------------
    // Capacity
    // -------------------------------------------------------------------------

    /**
     * Returns the number of elements the list can hold without reallocating.
     */
    public int capacity() {
        return elements.length;
    }

    /**
     * Ensures room for at least {@code additional} more elements without
     * reallocating, in both the sequence and the name index.
     *
     * @throws IllegalArgumentException if {@code additional} is negative
     * @throws IllegalStateException    if the required capacity overflows
     */
    public void reserve(int additional) {
        if (additional < 0) {
            throw new IllegalArgumentException("additional must not be negative: " + additional);
        }
        long required = (long) size + additional;
        if (required > MAX_CAPACITY) {
            throw new IllegalStateException("capacity overflow: " + size + " + " + additional);
        }
        if (required > elements.length) {
            log.debug("Reserving {} slots (was {})", required, elements.length);
            elements = Arrays.copyOf(elements, (int) required);
        }
        index.reserve((int) required);
    }

    /**
     * Reduces capacity to the current size.
     */
    public void shrinkToFit() {
        if (elements.length > size) {
            log.debug("Shrinking from {} to {} slots", elements.length, size);
            elements = Arrays.copyOf(elements, size);
        }
        index.compact();
    }

    // -------------------------------------------------------------------------
    // Diagnostics
    // -------------------------------------------------------------------------

    /**
     * Verifies that every element's name is bound to its position and that
     * the index holds no other names.
     *
     * @throws IllegalStateException describing the first mismatch found
     */
    public void assertConsistent() {
        if (index.size() != size) {
            inconsistent("index holds " + index.size() + " names for " + size + " elements");
        }
        for (int i = 0; i < size; i++) {
            String name = elementAt(i).name();
            OptionalInt bound = index.positionOf(name);
            if (bound.isEmpty()) {
                inconsistent("name '" + name + "' at position " + i + " is not indexed");
            } else if (bound.getAsInt() != i) {
                inconsistent("name '" + name + "' at position " + i + " is indexed at " + bound.getAsInt());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedList<?> other)) return false;
        return Arrays.equals(elements, 0, size, other.elements, 0, other.size);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = 0; i < size; i++) {
            h = 31 * h + elements[i].hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringJoiner out = new StringJoiner(", ", "{", "}");
        for (int i = 0; i < size; i++) {
            T element = elementAt(i);
            out.add(element.name() + "=" + element);
        }
        return out.toString();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static <T extends Named> T[] newArray(int capacity) {
        return (T[]) new Named[capacity];
    }

    private T elementAt(int position) {
        return elements[position];
    }

    private Optional<T> optionalAt(int position) {
        return position < 0 ? Optional.empty() : Optional.of(elementAt(position));
    }

    /** Resolves a key to a position, or -1 if it does not resolve. */
    private int resolve(Lookup key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof Lookup.Name byName) {
            return resolve(byName.name());
        }
        return resolve(((Lookup.Position) key).position());
    }

    private int resolve(String name) {
        return index.positionOf(Objects.requireNonNull(name, "name")).orElse(-1);
    }

    private int resolve(int position) {
        return position >= 0 && position < size ? position : -1;
    }

    private int requirePosition(Lookup key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof Lookup.Name byName) {
            return requirePosition(byName.name());
        }
        return requirePosition(((Lookup.Position) key).position());
    }

    private int requirePosition(String name) {
        Objects.requireNonNull(name, "name");
        return index.positionOf(name)
                .orElseThrow(() -> new NoSuchElementException("Unknown name: " + name));
    }

    private int requirePosition(int position) {
        return Objects.checkIndex(position, size);
    }

    private void swapPositions(int first, int second) {
        if (first == second) {
            return;
        }
        T a = elementAt(first);
        T b = elementAt(second);
        String aName = a.name();
        String bName = b.name();

        elements[first] = b;
        elements[second] = a;
        index.bind(aName, second);
        index.bind(bName, first);
        modCount++;
        log.trace("Swapped '{}' and '{}' at positions {} and {}", aName, bName, first, second);
    }

    private Optional<T> updateAt(int position, UnaryOperator<T> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        if (position < 0) {
            return Optional.empty();
        }
        T current = elementAt(position);
        // Read before applying; the operator may rename current in place.
        String currentName = current.name();
        T next = Objects.requireNonNull(replacement.apply(current), "replacement result");
        String nextName = nameOf(next);
        if (!nextName.equals(currentName)) {
            throw new IllegalArgumentException(
                    "Replacement for '" + currentName + "' reports a different name: '" + nextName + "'");
        }
        elements[position] = next;
        return Optional.of(current);
    }

    private static void inconsistent(String detail) {
        log.warn("Name index out of step with elements: {}", detail);
        throw new IllegalStateException("Name index out of step with elements: " + detail);
    }

    private static String nameOf(Named element) {
        String name = element.name();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Element name must not be null or empty: " + element);
        }
        return name;
    }

    private void ensureCapacity(int minCapacity) {
        if (minCapacity <= elements.length) {
            return;
        }
        if (minCapacity > MAX_CAPACITY) {
            throw new IllegalStateException("capacity overflow: " + minCapacity);
        }
        int grown = elements.length + (elements.length >> 1);
        if (elements.length == 0) {
            grown = NamedListConfig.DEFAULT_INITIAL_CAPACITY;
        }
        int newCapacity = (int) Math.min(MAX_CAPACITY, Math.max((long) grown, minCapacity));
        log.debug("Growing from {} to {} slots", elements.length, newCapacity);
        elements = Arrays.copyOf(elements, newCapacity);
    }

    private final class Itr implements Iterator<T>
    {
        private int cursor;
        private final int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return cursor < size;
        }

        @Override
        public T next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (cursor >= size) {
                throw new NoSuchElementException();
            }
            return elementAt(cursor++);
        }
    }
}
