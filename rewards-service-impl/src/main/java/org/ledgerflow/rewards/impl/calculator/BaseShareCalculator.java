// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Computes an account's proportional claim on the redistribution pool: a balance-weighted part
 * plus a score-weighted part. Each part truncates on its own, so the sum never exceeds the exact
 * share, and the share never exceeds the pool.
 */
@Singleton
public class BaseShareCalculator {

    private static final long PERCENT = 100;

    private final long balanceShareWeight;
    private final long scoreShareWeight;

    @Inject
    public BaseShareCalculator(@NonNull final RewardsConfig config) {
        requireNonNull(config);
        this.balanceShareWeight = config.balanceShareWeight();
        this.scoreShareWeight = config.scoreShareWeight();
    }

    /**
     * Computes the base share of the given account against the given globals.
     *
     * @param globals the ledger-wide counters
     * @param account the account
     * @return the base share, zero if the account holds nothing or nothing is outstanding
     */
    public long baseShare(@NonNull final RewardsGlobals globals, @NonNull final Account account) {
        requireNonNull(globals);
        requireNonNull(account);
        return baseShare(
                globals.redistributionPool(),
                globals.totalSupply(),
                globals.totalParticipationScore(),
                account.balance(),
                account.participationScore());
    }

    /**
     * Computes
     * {@code floor(pool * wb * balance / (100 * supply)) + floor(pool * ws * score / (100 * totalScore))}.
     *
     * @param pool the redistribution pool
     * @param totalSupply the total supply
     * @param totalScore the aggregate participation score
     * @param balance the account balance
     * @param score the account score
     * @return the base share
     */
    public long baseShare(
            final long pool, final long totalSupply, final long totalScore, final long balance, final long score) {
        if (balance <= 0 || totalScore <= 0 || totalSupply <= 0) {
            return 0;
        }
        final long balancePart = RewardsArithmetic.mulDiv(pool, balanceShareWeight, balance, PERCENT, totalSupply);
        final long scorePart = RewardsArithmetic.mulDiv(pool, scoreShareWeight, score, PERCENT, totalScore);
        return balancePart + scorePart;
    }
}
