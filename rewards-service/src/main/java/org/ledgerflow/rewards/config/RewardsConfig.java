// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Protocol constants of the fee rewards ledger. Bound from the {@code rewards.*} properties by
 * {@link RewardsConfigLoader}; the bundled {@code rewards-defaults.properties} holds the default
 * of every property. Values scaled by ten thousand are marked "(x10000)".
 *
 * @param feeBasisPoints the transfer fee in basis points
 * @param basisPointsDenominator the basis points in one whole
 * @param initialParticipationScore the score given at registration
 * @param maxParticipationScore the upper bound of every score
 * @param decayThresholdBlocks inactivity, in blocks, above which a score decays instead of growing
 * @param decayNumerator numerator of the decay factor
 * @param decayDenominator denominator of the decay factor
 * @param boostDivisor a boost adds the score divided by this value
 * @param claimScoreBoost the flat score increment after a payout
 * @param minHoldingPeriod blocks an account must hold, and must wait between payouts
 * @param multiplierRampPeriods holding periods over which the time multiplier ramps to its cap
 * @param multiplierScale the value of a 1.0x multiplier (x10000)
 * @param maxTimeMultiplier the cap of the time multiplier (x10000)
 * @param velocityBonus the bonus for a recent claim (x10000)
 * @param velocityWindowPeriods holding periods since the last claim within which the bonus applies
 * @param balanceShareWeight percent of the pool weighted by balance
 * @param scoreShareWeight percent of the pool weighted by participation score
 * @param eligibilityDivisor an account must hold at least total supply divided by this value
 * @param maxBatchSize the maximum number of beneficiaries per redistribution batch
 * @param adminAccount the account number of the administrator
 */
public record RewardsConfig(
        long feeBasisPoints,
        long basisPointsDenominator,
        long initialParticipationScore,
        long maxParticipationScore,
        long decayThresholdBlocks,
        long decayNumerator,
        long decayDenominator,
        long boostDivisor,
        long claimScoreBoost,
        long minHoldingPeriod,
        long multiplierRampPeriods,
        long multiplierScale,
        long maxTimeMultiplier,
        long velocityBonus,
        long velocityWindowPeriods,
        long balanceShareWeight,
        long scoreShareWeight,
        long eligibilityDivisor,
        int maxBatchSize,
        long adminAccount) {

    public RewardsConfig {
        requirePositive(basisPointsDenominator, "basisPointsDenominator");
        requireRange(feeBasisPoints, 0, basisPointsDenominator, "feeBasisPoints");
        requirePositive(maxParticipationScore, "maxParticipationScore");
        requireRange(initialParticipationScore, 0, maxParticipationScore, "initialParticipationScore");
        requireRange(decayThresholdBlocks, 0, Long.MAX_VALUE, "decayThresholdBlocks");
        requirePositive(decayDenominator, "decayDenominator");
        requireRange(decayNumerator, 0, decayDenominator, "decayNumerator");
        requirePositive(boostDivisor, "boostDivisor");
        requireRange(claimScoreBoost, 0, maxParticipationScore, "claimScoreBoost");
        requirePositive(minHoldingPeriod, "minHoldingPeriod");
        requirePositive(multiplierRampPeriods, "multiplierRampPeriods");
        requirePositive(multiplierScale, "multiplierScale");
        requireRange(maxTimeMultiplier, multiplierScale, Long.MAX_VALUE, "maxTimeMultiplier");
        requireRange(velocityBonus, 0, Long.MAX_VALUE, "velocityBonus");
        requireRange(velocityWindowPeriods, 0, Long.MAX_VALUE, "velocityWindowPeriods");
        requireRange(balanceShareWeight, 0, 100, "balanceShareWeight");
        requireRange(scoreShareWeight, 0, 100 - balanceShareWeight, "scoreShareWeight");
        requirePositive(eligibilityDivisor, "eligibilityDivisor");
        requirePositive(maxBatchSize, "maxBatchSize");
        requireRange(adminAccount, 0, Long.MAX_VALUE, "adminAccount");
    }

    /**
     * Returns the id of the administrator account.
     *
     * @return the administrator id
     */
    @NonNull
    public AccountId adminAccountId() {
        return AccountId.of(adminAccount);
    }

    /**
     * Returns the holding period, in blocks, at which the time multiplier reaches its cap.
     *
     * @return the ramp length in blocks
     */
    public long multiplierRampBlocks() {
        return Math.multiplyExact(minHoldingPeriod, multiplierRampPeriods);
    }

    /**
     * Returns the number of blocks since the last claim within which the velocity bonus applies.
     *
     * @return the window in blocks
     */
    public long velocityWindowBlocks() {
        return Math.multiplyExact(minHoldingPeriod, velocityWindowPeriods);
    }

    private static void requirePositive(final long value, @NonNull final String name) {
        if (value <= 0) {
            throw new IllegalArgumentException("rewards." + name + " must be positive, was " + value);
        }
    }

    private static void requireRange(final long value, final long min, final long max, @NonNull final String name) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "rewards." + name + " must be in [" + min + ", " + max + "], was " + value);
        }
    }
}
