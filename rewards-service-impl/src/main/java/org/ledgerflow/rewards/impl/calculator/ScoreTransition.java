// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * One step of the participation score state machine.
 *
 * @param kind what triggered the step
 * @param oldScore the score before the step
 * @param newScore the score after the step
 */
public record ScoreTransition(@NonNull Kind kind, long oldScore, long newScore) {

    public ScoreTransition {
        requireNonNull(kind);
    }

    /**
     * The kind of a transition.
     */
    public enum Kind {
        /** Activity after a long pause. */
        DECAY,
        /** Activity within the decay threshold. */
        BOOST,
        /** A successful redistribution payout. */
        CLAIM
    }

    /**
     * Returns the signed change of the score, to be applied to the aggregate score.
     *
     * @return {@code newScore - oldScore}
     */
    public long delta() {
        return newScore - oldScore;
    }
}
