// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Provides write access to the ledger-wide counters.
 */
public interface WritableRewardsGlobalsStore extends ReadableRewardsGlobalsStore {

    /**
     * Persists the globals.
     *
     * @param globals the globals to persist
     */
    void put(@NonNull RewardsGlobals globals);
}
