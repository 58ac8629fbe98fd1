// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.rewards.state.Account;

/**
 * Accumulates balance times blocks held. Must see the account as it was before the activity that
 * triggers it: the balance held during the interval, and the activity block that opened it.
 */
@Singleton
public class CumulativeHoldingsTracker {

    @Inject
    public CumulativeHoldingsTracker() {
        // No configuration
    }

    /**
     * Returns the account's cumulative holdings extended up to the given block.
     *
     * @param account the account before the activity
     * @param currentBlock the block of the activity, not before {@link Account#lastActivityBlock()}
     * @return the new cumulative holdings
     */
    @NonNull
    public BigInteger accrue(@NonNull final Account account, final long currentBlock) {
        requireNonNull(account);
        final long blocksHeld = currentBlock - account.lastActivityBlock();
        if (blocksHeld < 0) {
            throw new IllegalArgumentException(
                    "Block " + currentBlock + " is before last activity " + account.lastActivityBlock());
        }
        return account.cumulativeHoldings()
                .add(BigInteger.valueOf(account.balance()).multiply(BigInteger.valueOf(blocksHeld)));
    }
}
