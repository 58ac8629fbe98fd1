// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.ledgerflow.state.spi.WritableSingletonStateBase;

/**
 * A writable singleton state that reads through a {@link Supplier} and commits through a
 * {@link Consumer}.
 *
 * @param <S> The type of the value
 */
public class FunctionWritableSingletonState<S> extends WritableSingletonStateBase<S> {

    private final Supplier<S> backingStoreAccessor;
    private final Consumer<S> backingStoreMutator;

    /**
     * Creates a new instance.
     *
     * @param stateId The state ID for this instance.
     * @param backingStoreAccessor A {@link Supplier} that provides access to the value in the
     *     backing store.
     * @param backingStoreMutator A {@link Consumer} for mutating the value in the backing store.
     */
    public FunctionWritableSingletonState(
            final int stateId,
            @NonNull final Supplier<S> backingStoreAccessor,
            @NonNull final Consumer<S> backingStoreMutator) {
        super(stateId);
        this.backingStoreAccessor = requireNonNull(backingStoreAccessor);
        this.backingStoreMutator = requireNonNull(backingStoreMutator);
    }

    @Override
    protected S readFromDataSource() {
        return backingStoreAccessor.get();
    }

    @Override
    protected void putIntoDataSource(@NonNull final S value) {
        backingStoreMutator.accept(value);
    }
}
