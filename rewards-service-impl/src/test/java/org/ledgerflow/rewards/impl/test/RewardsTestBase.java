// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.test;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.config.RewardsConfigLoader;
import org.ledgerflow.rewards.impl.WritableAccountStoreImpl;
import org.ledgerflow.rewards.impl.WritableRewardsGlobalsStoreImpl;
import org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.state.memory.InMemoryState;
import org.ledgerflow.state.spi.CommittableWritableStates;

public class RewardsTestBase {

    protected static final AccountId ADMIN = AccountId.of(2);
    protected static final AccountId ALICE = AccountId.of(1001);
    protected static final AccountId BOB = AccountId.of(1002);
    protected static final AccountId CAROL = AccountId.of(1003);

    protected final RewardsConfig config = RewardsConfigLoader.defaults();

    // states declarations
    protected InMemoryState state;
    protected CommittableWritableStates writableStates;
    protected WritableAccountStoreImpl writableAccountStore;
    protected WritableRewardsGlobalsStoreImpl writableGlobalsStore;

    protected void setupStates() {
        state = V0100RewardsSchema.newGenesisState();
        writableStates = state.getWritableStates();
        writableAccountStore = new WritableAccountStoreImpl(writableStates);
        writableGlobalsStore = new WritableRewardsGlobalsStoreImpl(writableStates);
    }

    /**
     * Commits an account and folds its balance and score into the globals, the way registration
     * followed by minting would.
     */
    protected void givenAccount(@NonNull final Account account) {
        final var globals = writableGlobalsStore.get();
        writableAccountStore.put(account);
        writableGlobalsStore.put(globals.copyBuilder()
                .totalSupply(globals.totalSupply() + account.balance())
                .totalParticipationScore(globals.totalParticipationScore() + account.participationScore())
                .registeredCount(globals.registeredCount() + 1)
                .build());
        writableStates.commit();
    }

    protected void givenPool(final long pool, final boolean active) {
        final var globals = writableGlobalsStore.get();
        writableGlobalsStore.put(globals.copyBuilder()
                .redistributionPool(pool)
                .totalSupply(globals.totalSupply() + pool)
                .redistributionActive(active)
                .build());
        writableStates.commit();
    }

    @NonNull
    protected Account account(@NonNull final AccountId id, final long balance, final long score, final long block) {
        return new Account(id, balance, score, block, block, BigInteger.ZERO);
    }

    @NonNull
    protected RewardsGlobals globals() {
        return writableGlobalsStore.get();
    }

    @NonNull
    protected Account accountOf(@NonNull final AccountId id) {
        return writableAccountStore.getAccountById(id);
    }
}
