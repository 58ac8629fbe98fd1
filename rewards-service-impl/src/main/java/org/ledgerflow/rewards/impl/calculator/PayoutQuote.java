// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

/**
 * The terms of one beneficiary's payout within a redistribution batch.
 *
 * @param blocksHeld blocks since the beneficiary's last activity
 * @param blocksSinceClaim blocks since the beneficiary's last payout
 * @param timeMultiplier the time multiplier (x10000)
 * @param velocityBonus the velocity bonus (x10000)
 * @param baseShare the base share before adjustments
 * @param adjustedShare the base share after the time multiplier and velocity bonus
 * @param eligible whether the beneficiary passes the balance, amount and waiting period checks
 */
public record PayoutQuote(
        long blocksHeld,
        long blocksSinceClaim,
        long timeMultiplier,
        long velocityBonus,
        long baseShare,
        long adjustedShare,
        boolean eligible) {

    /**
     * Returns the amount to pay.
     *
     * @return the adjusted share if eligible, zero otherwise
     */
    public long payout() {
        return eligible ? adjustedShare : 0;
    }
}
