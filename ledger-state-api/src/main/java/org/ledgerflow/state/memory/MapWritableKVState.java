// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.ledgerflow.state.spi.WritableKVState;
import org.ledgerflow.state.spi.WritableKVStateBase;

/**
 * A simple implementation of {@link WritableKVState} backed by a {@link Map}. Writes only reach
 * the map on {@link #commit()}.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class MapWritableKVState<K, V> extends WritableKVStateBase<K, V> {

    /** Represents the backing storage for this state */
    private final Map<K, V> backingStore;

    /**
     * Create an instance using the given map as the backing store.
     *
     * @param stateId The state ID
     * @param label The state label
     * @param backingStore The backing store to use
     */
    public MapWritableKVState(final int stateId, @NonNull final String label, @NonNull final Map<K, V> backingStore) {
        super(stateId, label);
        this.backingStore = requireNonNull(backingStore);
    }

    @Override
    protected V readFromDataSource(@NonNull final K key) {
        return backingStore.get(key);
    }

    @NonNull
    @Override
    protected Iterator<K> iterateFromDataSource() {
        // Copy so that a commit during iteration cannot fail the iterator
        return List.copyOf(backingStore.keySet()).iterator();
    }

    @Override
    protected long sizeOfDataSource() {
        return backingStore.size();
    }

    @Override
    protected void putIntoDataSource(@NonNull final K key, @NonNull final V value) {
        backingStore.put(key, value);
    }
}
