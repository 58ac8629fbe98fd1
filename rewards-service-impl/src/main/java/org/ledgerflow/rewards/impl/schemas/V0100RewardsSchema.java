// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.schemas;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.state.memory.InMemoryState;

/**
 * The genesis schema of the rewards service: one key value state of accounts, keyed by account
 * id, and one singleton of ledger-wide counters.
 */
public final class V0100RewardsSchema {

    public static final int ACCOUNTS_STATE_ID = 1;
    public static final String ACCOUNTS_STATE_LABEL = "RewardsService.ACCOUNTS";
    public static final int REWARDS_GLOBALS_STATE_ID = 2;
    public static final String REWARDS_GLOBALS_STATE_LABEL = "RewardsService.REWARDS_GLOBALS";

    private V0100RewardsSchema() {
        // Utility class
    }

    /**
     * Registers the states of this schema in the given state.
     *
     * @param state the state to register in
     * @return the same state
     */
    @NonNull
    public static InMemoryState registerStates(@NonNull final InMemoryState state) {
        return state.registerKeyValue(ACCOUNTS_STATE_ID, ACCOUNTS_STATE_LABEL)
                .registerSingleton(REWARDS_GLOBALS_STATE_ID, REWARDS_GLOBALS_STATE_LABEL);
    }

    /**
     * Creates an empty state with the states of this schema registered.
     *
     * @return the new state
     */
    @NonNull
    public static InMemoryState newGenesisState() {
        return registerStates(new InMemoryState());
    }
}
