// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * The participation score state machine. Every qualifying activity moves an account's score one
 * step; the aggregate score in {@link RewardsGlobals} moves by the same signed delta, so it always
 * equals the sum of all account scores without a rescan.
 *
 * <p>A boost adds one percent of the current score, truncated. Scores below the boost divisor
 * therefore never grow through activity alone; only payouts can lift them.
 */
@Singleton
public class ParticipationScoreEngine {

    private final RewardsConfig config;

    @Inject
    public ParticipationScoreEngine(@NonNull final RewardsConfig config) {
        this.config = requireNonNull(config);
    }

    /**
     * Computes the activity transition for a score.
     *
     * @param oldScore the current score
     * @param elapsedBlocks blocks since the account's last recorded activity
     * @return the transition
     */
    @NonNull
    public ScoreTransition onActivity(final long oldScore, final long elapsedBlocks) {
        if (elapsedBlocks > config.decayThresholdBlocks()) {
            final long decayed = oldScore * config.decayNumerator() / config.decayDenominator();
            return new ScoreTransition(ScoreTransition.Kind.DECAY, oldScore, decayed);
        }
        final long boosted = Math.min(config.maxParticipationScore(), oldScore + oldScore / config.boostDivisor());
        return new ScoreTransition(ScoreTransition.Kind.BOOST, oldScore, boosted);
    }

    /**
     * Computes the flat transition applied after a redistribution payout.
     *
     * @param oldScore the current score
     * @return the transition
     */
    @NonNull
    public ScoreTransition onClaim(final long oldScore) {
        final long boosted = Math.min(config.maxParticipationScore(), oldScore + config.claimScoreBoost());
        return new ScoreTransition(ScoreTransition.Kind.CLAIM, oldScore, boosted);
    }

    /**
     * Applies a transition's delta to the aggregate score.
     *
     * @param globals the globals builder to update
     * @param transition the transition
     * @throws IllegalStateException if the aggregate would become negative, which means the
     *     aggregate and the account scores have diverged
     */
    public void applyToTotal(@NonNull final RewardsGlobals.Builder globals, @NonNull final ScoreTransition transition) {
        requireNonNull(globals);
        requireNonNull(transition);
        final long current = globals.totalParticipationScore();
        final long updated = current + transition.delta();
        if (updated < 0) {
            throw new IllegalStateException("Aggregate participation score would become " + updated);
        }
        globals.totalParticipationScore(updated);
    }
}
