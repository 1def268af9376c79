package com.questrail.namedlist.core;

import com.questrail.namedlist.mapping.HashNameIndex;

/**
 * Construction-time configuration for a {@link NamedList}.
 *
 * @param initialCapacity number of elements the list can hold before its first reallocation
 * @param indexLoadFactor load factor of the name index hash table
 */
public record NamedListConfig(
    int initialCapacity,
    float indexLoadFactor
) {
    public static final int DEFAULT_INITIAL_CAPACITY = 10;

    public NamedListConfig {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must not be negative: " + initialCapacity);
        }
        if (indexLoadFactor <= 0 || Float.isNaN(indexLoadFactor) || Float.isInfinite(indexLoadFactor)) {
            throw new IllegalArgumentException("Illegal index load factor: " + indexLoadFactor);
        }
    }

    public static NamedListConfig defaults() {
        return new NamedListConfig(DEFAULT_INITIAL_CAPACITY, HashNameIndex.DEFAULT_LOAD_FACTOR);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
        private float indexLoadFactor = HashNameIndex.DEFAULT_LOAD_FACTOR;

        public Builder withInitialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder withIndexLoadFactor(float indexLoadFactor) {
            this.indexLoadFactor = indexLoadFactor;
            return this;
        }

        public NamedListConfig build() {
            return new NamedListConfig(initialCapacity, indexLoadFactor);
        }
    }
}
