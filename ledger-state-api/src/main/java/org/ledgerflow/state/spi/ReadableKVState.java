// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;

/**
 * Provides stable key value state. Keys and values are immutable domain objects; a value read from
 * this state is never mutated in place, a new value is {@code put} instead.
 *
 * @param <K> The type of the key
 * @param <V> The type of the value
 */
public interface ReadableKVState<K, V> {

    /**
     * Gets the state ID of this state.
     *
     * @return The state ID
     */
    int getStateId();

    /**
     * Gets the value associated with the given key in a read-only way.
     *
     * @param key The key. Cannot be null.
     * @return The value, or null if there is no such key in the state
     */
    @Nullable
    V get(@NonNull K key);

    /**
     * Used during migration only, returns whether the state contains the given key.
     *
     * @param key The key. Cannot be null.
     * @return true if the key is present
     */
    default boolean contains(@NonNull final K key) {
        return get(key) != null;
    }

    /**
     * Iterates over all keys in the state. Intended for audits and snapshots, not for handling.
     *
     * @return an iterator over the keys
     */
    @NonNull
    Iterator<K> keys();

    /**
     * Gets the number of keys in the state.
     *
     * @return the number of keys
     */
    long size();
}
