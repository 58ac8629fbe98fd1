// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Prices a beneficiary's payout in an algorithmic redistribution batch. The base share is scaled
 * by a time multiplier that ramps linearly from 1.0x at the minimum holding period to its cap, and
 * by a velocity bonus for accounts that were paid recently. A payout additionally requires a
 * minimum balance and a full holding period since the last payout.
 */
@Singleton
public class RedistributionCalculator {

    private final RewardsConfig config;
    private final BaseShareCalculator baseShareCalculator;

    @Inject
    public RedistributionCalculator(
            @NonNull final RewardsConfig config, @NonNull final BaseShareCalculator baseShareCalculator) {
        this.config = requireNonNull(config);
        this.baseShareCalculator = requireNonNull(baseShareCalculator);
    }

    /**
     * Returns the time multiplier for the given holding duration. Below the minimum holding period
     * it is exactly 1.0x; from there it grows by {@code blocksHeld / rampBlocks} up to the cap.
     *
     * @param blocksHeld blocks since the last activity
     * @return the multiplier (x10000)
     */
    public long timeMultiplier(final long blocksHeld) {
        final long scale = config.multiplierScale();
        if (blocksHeld < config.minHoldingPeriod()) {
            return scale;
        }
        final var ramp = BigInteger.valueOf(blocksHeld)
                .multiply(BigInteger.valueOf(scale))
                .divide(BigInteger.valueOf(config.multiplierRampBlocks()));
        return ramp.add(BigInteger.valueOf(scale))
                .min(BigInteger.valueOf(config.maxTimeMultiplier()))
                .longValueExact();
    }

    /**
     * Returns the velocity bonus for the given time since the last payout.
     *
     * @param blocksSinceClaim blocks since the last payout
     * @return the bonus (x10000)
     */
    public long velocityBonus(final long blocksSinceClaim) {
        return blocksSinceClaim < config.velocityWindowBlocks() ? config.velocityBonus() : 0;
    }

    /**
     * Applies a multiplier and a bonus to a base share:
     * {@code floor(base * multiplier * (scale + bonus) / (scale * scale))}.
     *
     * @param baseShare the base share
     * @param timeMultiplier the time multiplier (x10000)
     * @param velocityBonus the velocity bonus (x10000)
     * @return the adjusted share
     */
    public long adjustedShare(final long baseShare, final long timeMultiplier, final long velocityBonus) {
        final long scale = config.multiplierScale();
        return RewardsArithmetic.mulDiv(baseShare, timeMultiplier, scale + velocityBonus, scale, scale);
    }

    /**
     * Prices the payout of an account against the globals as they stand at this point of the
     * batch. Earlier payouts in the same batch have already shrunk the pool.
     *
     * @param globals the ledger-wide counters
     * @param account the beneficiary
     * @param currentBlock the block of the batch
     * @return the quote
     */
    @NonNull
    public PayoutQuote quote(
            @NonNull final RewardsGlobals globals, @NonNull final Account account, final long currentBlock) {
        requireNonNull(globals);
        requireNonNull(account);
        final long blocksHeld = currentBlock - account.lastActivityBlock();
        final long blocksSinceClaim = currentBlock - account.lastClaimBlock();
        final long multiplier = timeMultiplier(blocksHeld);
        final long bonus = velocityBonus(blocksSinceClaim);
        final long base = baseShareCalculator.baseShare(globals, account);
        final long adjusted = adjustedShare(base, multiplier, bonus);
        final boolean eligible = account.balance() >= globals.totalSupply() / config.eligibilityDivisor()
                && adjusted > 0
                && blocksSinceClaim >= config.minHoldingPeriod();
        return new PayoutQuote(blocksHeld, blocksSinceClaim, multiplier, bonus, base, adjusted, eligible);
    }
}
