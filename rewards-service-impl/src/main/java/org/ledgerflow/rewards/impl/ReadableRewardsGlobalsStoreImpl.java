// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema.REWARDS_GLOBALS_STATE_ID;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.state.spi.ReadableSingletonState;
import org.ledgerflow.state.spi.ReadableStates;

/**
 * Default implementation of {@link ReadableRewardsGlobalsStore}.
 */
public class ReadableRewardsGlobalsStoreImpl implements ReadableRewardsGlobalsStore {

    /** The underlying data storage class that holds the ledger-wide counters. */
    private final ReadableSingletonState<RewardsGlobals> globalsState;

    /**
     * Create a new {@link ReadableRewardsGlobalsStoreImpl} instance.
     *
     * @param states The state to use.
     */
    public ReadableRewardsGlobalsStoreImpl(@NonNull final ReadableStates states) {
        this.globalsState = requireNonNull(states).getSingleton(REWARDS_GLOBALS_STATE_ID);
    }

    @NonNull
    @Override
    public RewardsGlobals get() {
        return Objects.requireNonNullElse(globalsState.get(), RewardsGlobals.DEFAULT);
    }
}
