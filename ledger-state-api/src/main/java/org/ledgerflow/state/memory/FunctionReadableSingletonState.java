// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.function.Supplier;
import org.ledgerflow.state.spi.ReadableSingletonStateBase;

/**
 * A singleton state that reads its value through a {@link Supplier}.
 *
 * @param <S> The type of the value
 */
public class FunctionReadableSingletonState<S> extends ReadableSingletonStateBase<S> {

    private final Supplier<S> backingStoreAccessor;

    /**
     * Creates a new instance.
     *
     * @param stateId The state ID for this instance.
     * @param backingStoreAccessor A {@link Supplier} that provides access to the value in the
     *     backing store.
     */
    public FunctionReadableSingletonState(final int stateId, @NonNull final Supplier<S> backingStoreAccessor) {
        super(stateId);
        this.backingStoreAccessor = requireNonNull(backingStoreAccessor);
    }

    @Override
    protected S readFromDataSource() {
        return backingStoreAccessor.get();
    }
}
