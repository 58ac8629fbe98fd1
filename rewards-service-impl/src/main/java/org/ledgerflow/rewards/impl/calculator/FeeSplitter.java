// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.rewards.config.RewardsConfig;

/**
 * Splits a transfer amount into the fee that funds the redistribution pool and the net amount the
 * recipient is credited. The fee is truncated to a whole unit.
 */
@Singleton
public class FeeSplitter {

    private final long feeBasisPoints;
    private final long basisPointsDenominator;

    @Inject
    public FeeSplitter(@NonNull final RewardsConfig config) {
        requireNonNull(config);
        this.feeBasisPoints = config.feeBasisPoints();
        this.basisPointsDenominator = config.basisPointsDenominator();
    }

    /**
     * Returns {@code floor(amount * feeBasisPoints / basisPointsDenominator)}.
     *
     * @param amount a positive amount
     * @return the fee
     */
    public long fee(final long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must be non-negative, was " + amount);
        }
        return RewardsArithmetic.mulDiv(amount, feeBasisPoints, basisPointsDenominator);
    }

    /**
     * Returns the amount minus its fee.
     *
     * @param amount a positive amount
     * @return the net amount
     */
    public long net(final long amount) {
        return amount - fee(amount);
    }
}
