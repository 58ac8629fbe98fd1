// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Provides read-only access to the ledger-wide counters.
 */
public interface ReadableRewardsGlobalsStore {

    /**
     * Returns the {@link RewardsGlobals} in state, or {@link RewardsGlobals#DEFAULT} if they were
     * never written.
     *
     * @return the globals
     */
    @NonNull
    RewardsGlobals get();
}
