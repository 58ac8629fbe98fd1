// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A base class for implementations of {@link WritableSingletonState}. The new value is buffered
 * until {@link #commit()}.
 *
 * @param <T> The type of the value
 */
public abstract class WritableSingletonStateBase<T> extends ReadableSingletonStateBase<T>
        implements WritableSingletonState<T> {

    private boolean modified = false;
    private T value;

    /**
     * Creates a new instance.
     *
     * @param stateId The state ID for this instance.
     */
    protected WritableSingletonStateBase(final int stateId) {
        super(stateId);
    }

    @Override
    public T get() {
        if (modified) {
            return value;
        }
        return super.get();
    }

    @Override
    public void put(@NonNull final T value) {
        this.value = requireNonNull(value);
        this.modified = true;
    }

    @Override
    public boolean isModified() {
        return modified;
    }

    /**
     * Flushes the buffered value, if any, into the underlying data source.
     */
    public void commit() {
        if (modified) {
            putIntoDataSource(value);
        }
        reset();
    }

    @Override
    public void reset() {
        super.reset();
        this.modified = false;
        this.value = null;
    }

    /**
     * Writes the value into the underlying data source.
     *
     * @param value the value to write
     */
    protected abstract void putIntoDataSource(@NonNull T value);
}
