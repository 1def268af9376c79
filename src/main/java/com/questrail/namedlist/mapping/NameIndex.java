package com.questrail.namedlist.mapping;

import java.util.OptionalInt;

/**
 * NameIndex
 * -----------------------------------------------------------------------------
 * {@code NameIndex} defines the mapping between element names and the dense,
 * 0-based positions at which those elements are stored.
 *
 * <h2>Why this exists</h2>
 * A {@code NamedList} keeps two structures in step: the ordered sequence of
 * elements and this index. Keeping the index behind an explicit boundary means
 * the collection never manipulates a raw map, and every place that binds or
 * unbinds a name is easy to find.
 *
 * <h2>Index Semantics</h2>
 * A {@code NameIndex} is a plain mutable mapping. It does <b>not</b> know the
 * length of the sequence it describes and performs no consistency checks of
 * its own; keeping it consistent is the owning collection's job.
 * <ul>
 *   <li>Positions are 0-based and non-negative</li>
 *   <li>Each name has at most one position</li>
 *   <li>Lookups are expected to be O(1) on average</li>
 * </ul>
 *
 * <h2>Capacity</h2>
 * {@link #reserve(int)} and {@link #compact()} only affect allocation
 * headroom. They never change which names are bound or to which positions.
 */
public interface NameIndex
{
    /**
     * Returns the number of bound names.
     */
    int size();

    /**
     * Returns the position bound to {@code name}, or empty if unbound.
     *
     * @param name element name
     * @return the bound position
     */
    OptionalInt positionOf(String name);

    /**
     * Binds {@code name} to {@code position}, replacing any previous binding.
     *
     * @param name     element name
     * @param position 0-based position
     * @throws IllegalArgumentException if {@code position} is negative
     */
    void bind(String name, int position);

    /**
     * Removes the binding for {@code name}.
     *
     * @param name element name
     * @return the position that was bound, or empty if there was none
     */
    OptionalInt unbind(String name);

    /**
     * Removes all bindings.
     */
    void clear();

    /**
     * Sizes the index so that {@code expectedSize} names can be bound without
     * rehashing.
     *
     * @param expectedSize total number of names expected
     */
    void reserve(int expectedSize);

    /**
     * Releases allocation headroom beyond what the current bindings need.
     */
    void compact();

    /**
     * Returns true if {@code name} is bound.
     */
    default boolean contains(String name) {
        return positionOf(name).isPresent();
    }
}
