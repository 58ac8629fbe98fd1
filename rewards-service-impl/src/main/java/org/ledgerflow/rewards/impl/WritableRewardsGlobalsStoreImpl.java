// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema.REWARDS_GLOBALS_STATE_ID;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.state.spi.WritableSingletonState;
import org.ledgerflow.state.spi.WritableStates;

/**
 * Default writable implementation for the ledger-wide counters.
 */
public class WritableRewardsGlobalsStoreImpl extends ReadableRewardsGlobalsStoreImpl
        implements WritableRewardsGlobalsStore {

    private final WritableSingletonState<RewardsGlobals> globalsState;

    /**
     * Create a new {@link WritableRewardsGlobalsStoreImpl} instance.
     *
     * @param states The state to use.
     */
    public WritableRewardsGlobalsStoreImpl(@NonNull final WritableStates states) {
        super(states);
        this.globalsState = states.getSingleton(REWARDS_GLOBALS_STATE_ID);
    }

    @Override
    public void put(@NonNull final RewardsGlobals globals) {
        requireNonNull(globals);
        globalsState.put(globals);
    }
}
