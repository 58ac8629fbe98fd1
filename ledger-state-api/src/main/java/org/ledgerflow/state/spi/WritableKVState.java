// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;

/**
 * A {@link ReadableKVState} that can be modified. Modifications are buffered until the owner of the
 * state commits them. Entries can be added and replaced but never removed.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public interface WritableKVState<K, V> extends ReadableKVState<K, V> {

    /**
     * Adds a new value to the store, or updates an existing value.
     *
     * @param key The key. Cannot be null.
     * @param value The value. Cannot be null.
     */
    void put(@NonNull K key, @NonNull V value);

    /**
     * Gets the set of keys modified since the last commit or reset.
     *
     * @return the modified keys
     */
    @NonNull
    Set<K> modifiedKeys();
}
