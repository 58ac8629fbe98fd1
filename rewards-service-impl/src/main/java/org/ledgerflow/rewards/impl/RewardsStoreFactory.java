// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.function.Function;
import org.ledgerflow.app.spi.store.StoreFactory;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.state.spi.ReadableStates;
import org.ledgerflow.state.spi.WritableStates;

/**
 * Creates the stores of the rewards service over one operation's states. Readable stores see the
 * committed state; writable stores see the committed state plus the operation's own buffered
 * writes.
 */
public class RewardsStoreFactory implements StoreFactory {

    private static final Map<Class<?>, Function<ReadableStates, ?>> READABLE_STORE_CREATORS = Map.of(
            ReadableAccountStore.class, ReadableAccountStoreImpl::new,
            ReadableRewardsGlobalsStore.class, ReadableRewardsGlobalsStoreImpl::new);

    private static final Map<Class<?>, Function<WritableStates, ?>> WRITABLE_STORE_CREATORS = Map.of(
            WritableAccountStore.class, WritableAccountStoreImpl::new,
            WritableRewardsGlobalsStore.class, WritableRewardsGlobalsStoreImpl::new);

    private final ReadableStates readableStates;
    private final WritableStates writableStates;

    public RewardsStoreFactory(
            @NonNull final ReadableStates readableStates, @NonNull final WritableStates writableStates) {
        this.readableStates = requireNonNull(readableStates);
        this.writableStates = requireNonNull(writableStates);
    }

    @NonNull
    @Override
    public <T> T readableStore(@NonNull final Class<T> storeInterface) {
        requireNonNull(storeInterface);
        final var creator = READABLE_STORE_CREATORS.get(storeInterface);
        if (creator == null) {
            throw new IllegalArgumentException("No readable store of type " + storeInterface.getName());
        }
        return storeInterface.cast(creator.apply(readableStates));
    }

    @NonNull
    @Override
    public <T> T writableStore(@NonNull final Class<T> storeInterface) {
        requireNonNull(storeInterface);
        final var creator = WRITABLE_STORE_CREATORS.get(storeInterface);
        if (creator == null) {
            throw new IllegalArgumentException("No writable store of type " + storeInterface.getName());
        }
        return storeInterface.cast(creator.apply(writableStates));
    }
}
