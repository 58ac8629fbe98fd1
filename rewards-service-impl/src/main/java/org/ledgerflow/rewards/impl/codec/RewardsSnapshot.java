// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.codec;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * A complete copy of the rewards state.
 *
 * @param globals the global counters
 * @param accounts every registered account
 */
public record RewardsSnapshot(@NonNull RewardsGlobals globals, @NonNull List<Account> accounts) {

    public RewardsSnapshot {
        requireNonNull(globals);
        accounts = List.copyOf(accounts);
    }
}
