// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A base class for implementations of {@link WritableKVState}.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public abstract class WritableKVStateBase<K, V> extends ReadableKVStateBase<K, V> implements WritableKVState<K, V> {

    /** A map of all modified values buffered in this mutable state. */
    private final Map<K, V> modifications = new LinkedHashMap<>();

    /**
     * Create a new StateBase.
     *
     * @param stateId The state ID
     * @param label The state label
     */
    protected WritableKVStateBase(final int stateId, @NonNull final String label) {
        super(stateId, label);
    }

    /**
     * Flushes all changes into the underlying data store. This method should <strong>ONLY</strong>
     * be called by the code that created the {@link WritableKVStateBase} instance or owns it.
     */
    public void commit() {
        modifications.forEach(this::putIntoDataSource);
        reset();
    }

    /**
     * Clears the set of modified keys. Equivalent semantically to a "rollback" operation.
     */
    public final void reset() {
        modifications.clear();
    }

    @Override
    @Nullable
    public final V get(@NonNull final K key) {
        requireNonNull(key);
        // A buffered put wins over the data source
        final var modified = modifications.get(key);
        return modified != null ? modified : super.get(key);
    }

    @Override
    public final void put(@NonNull final K key, @NonNull final V value) {
        requireNonNull(key);
        requireNonNull(value);
        modifications.put(key, value);
    }

    @NonNull
    @Override
    public final Set<K> modifiedKeys() {
        return Collections.unmodifiableSet(modifications.keySet());
    }

    @NonNull
    @Override
    public Iterator<K> keys() {
        final Set<K> merged = new LinkedHashSet<>();
        iterateFromDataSource().forEachRemaining(merged::add);
        merged.addAll(modifications.keySet());
        return merged.iterator();
    }

    @Override
    public long size() {
        long count = sizeOfDataSource();
        for (final var key : modifications.keySet()) {
            if (readFromDataSource(key) == null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Puts the given key/value pair into the underlying data source.
     *
     * @param key key to update
     * @param value value to put
     */
    protected abstract void putIntoDataSource(@NonNull K key, @NonNull V value);
}
