// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.Map;
import org.ledgerflow.state.spi.ReadableKVState;
import org.ledgerflow.state.spi.ReadableKVStateBase;

/**
 * A simple implementation of {@link ReadableKVState} backed by a {@link Map}.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class MapReadableKVState<K, V> extends ReadableKVStateBase<K, V> {

    /** Represents the backing storage for this state */
    private final Map<K, V> backingStore;

    /**
     * Create an instance using the given map as the backing store. The map is not copied, so
     * writes made to it elsewhere are visible here.
     *
     * @param stateId The state ID
     * @param label The state label
     * @param backingStore The backing store to use
     */
    public MapReadableKVState(final int stateId, @NonNull final String label, @NonNull final Map<K, V> backingStore) {
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
        return backingStore.keySet().iterator();
    }

    @Override
    protected long sizeOfDataSource() {
        return backingStore.size();
    }
}
