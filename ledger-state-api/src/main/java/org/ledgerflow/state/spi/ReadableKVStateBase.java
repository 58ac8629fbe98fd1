// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;

/**
 * A base class for implementations of {@link ReadableKVState}.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public abstract class ReadableKVStateBase<K, V> implements ReadableKVState<K, V> {

    /** The state ID */
    protected final int stateId;

    /** The state label, used in logs and error messages */
    protected final String label;

    /**
     * Create a new StateBase.
     *
     * @param stateId The state ID
     * @param label The state label
     */
    protected ReadableKVStateBase(final int stateId, @NonNull final String label) {
        this.stateId = stateId;
        this.label = requireNonNull(label);
    }

    @Override
    public final int getStateId() {
        return stateId;
    }

    /**
     * Gets the label of this state.
     *
     * @return the label
     */
    @NonNull
    public final String getLabel() {
        return label;
    }

    @Override
    @Nullable
    public V get(@NonNull final K key) {
        requireNonNull(key);
        return readFromDataSource(key);
    }

    @NonNull
    @Override
    public Iterator<K> keys() {
        return iterateFromDataSource();
    }

    @Override
    public long size() {
        return sizeOfDataSource();
    }

    /**
     * Reads the value for the key from the underlying data source.
     *
     * @param key key to read from state
     * @return The value read from the underlying data source. May be null.
     */
    @Nullable
    protected abstract V readFromDataSource(@NonNull K key);

    /**
     * Gets an iterator over the keys of the underlying data source.
     *
     * @return An iterator over all keys in the underlying data source.
     */
    @NonNull
    protected abstract Iterator<K> iterateFromDataSource();

    /**
     * Gets the number of keys in the underlying data source.
     *
     * @return the number of keys
     */
    protected abstract long sizeOfDataSource();
}
