package com.questrail.namedlist.api;

import java.util.Objects;

/**
 * Lookup
 * -----------------------------------------------------------------------------
 * A key used to address an element of a {@code NamedList}, either by its
 * {@link Name name} or by its {@link Position position}.
 *
 * A {@code Lookup} is consumed at call time and never stored. Collection
 * methods accept raw {@code String} and {@code int} arguments as well, so
 * callers rarely need to construct one explicitly:
 *
 * <pre>{@code
 * list.get("speed");            // preferred
 * list.get(Lookup.of("speed")); // equivalent
 * }</pre>
 *
 * Explicit construction is useful when the kind of key is decided at runtime,
 * e.g. when parsing user input that may be a number or a name.
 */
public sealed interface Lookup
        permits Lookup.Name, Lookup.Position
{
    /**
     * Creates a lookup by name.
     */
    static Lookup of(String name) {
        return new Name(name);
    }

    /**
     * Creates a lookup by 0-based position.
     *
     * @throws IllegalArgumentException if {@code position} is negative
     */
    static Lookup of(int position) {
        return new Position(position);
    }

    /**
     * Addresses an element by name.
     */
    record Name(String name) implements Lookup
    {
        public Name {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return '"' + name + '"';
        }
    }

    /**
     * Addresses an element by 0-based position.
     */
    record Position(int position) implements Lookup
    {
        public Position {
            if (position < 0) {
                throw new IllegalArgumentException("position must not be negative: " + position);
            }
        }

        @Override
        public String toString() {
            return "#" + position;
        }
    }
}
