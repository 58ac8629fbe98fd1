// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

/**
 * A convenient implementation of {@link ReadableSingletonState}.
 *
 * @param <T> The type of the value
 */
public abstract class ReadableSingletonStateBase<T> implements ReadableSingletonState<T> {

    private boolean read = false;

    protected final int stateId;

    /**
     * Creates a new instance.
     *
     * @param stateId The state ID for this instance.
     */
    protected ReadableSingletonStateBase(final int stateId) {
        this.stateId = stateId;
    }

    @Override
    public final int getStateId() {
        return stateId;
    }

    @Override
    public T get() {
        final var value = readFromDataSource();
        this.read = true;
        return value;
    }

    /**
     * Reads the data from the underlying data source.
     *
     * @return The value read from the underlying data source. May be null.
     */
    protected abstract T readFromDataSource();

    @Override
    public boolean isRead() {
        return read;
    }

    /** Clears any cached data, including whether the instance has been read. */
    public void reset() {
        this.read = false;
    }
}
