// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.state;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The single shared record of ledger-wide counters.
 *
 * @param redistributionPool accumulated fees not yet paid out
 * @param totalSupply units minted so far
 * @param totalParticipationScore the sum of the participation scores of all accounts
 * @param redistributionActive whether algorithmic redistribution may run
 * @param registeredCount the number of registered accounts
 */
public record RewardsGlobals(
        long redistributionPool,
        long totalSupply,
        long totalParticipationScore,
        boolean redistributionActive,
        long registeredCount) {

    /** The value of a ledger nobody has touched yet. */
    public static final RewardsGlobals DEFAULT = new RewardsGlobals(0, 0, 0, false, 0);

    public RewardsGlobals {
        if (redistributionPool < 0 || totalSupply < 0 || totalParticipationScore < 0 || registeredCount < 0) {
            throw new IllegalArgumentException("Global counters must be non-negative");
        }
    }

    /**
     * Returns a builder initialized with these values.
     *
     * @return the builder
     */
    @NonNull
    public Builder copyBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for {@link RewardsGlobals}.
     */
    public static final class Builder {
        private long redistributionPool;
        private long totalSupply;
        private long totalParticipationScore;
        private boolean redistributionActive;
        private long registeredCount;

        private Builder(@NonNull final RewardsGlobals source) {
            this.redistributionPool = source.redistributionPool;
            this.totalSupply = source.totalSupply;
            this.totalParticipationScore = source.totalParticipationScore;
            this.redistributionActive = source.redistributionActive;
            this.registeredCount = source.registeredCount;
        }

        public Builder redistributionPool(final long redistributionPool) {
            this.redistributionPool = redistributionPool;
            return this;
        }

        public Builder totalSupply(final long totalSupply) {
            this.totalSupply = totalSupply;
            return this;
        }

        public Builder totalParticipationScore(final long totalParticipationScore) {
            this.totalParticipationScore = totalParticipationScore;
            return this;
        }

        /**
         * Returns the aggregate participation score as currently set on this builder.
         *
         * @return the aggregate participation score
         */
        public long totalParticipationScore() {
            return totalParticipationScore;
        }

        public Builder redistributionActive(final boolean redistributionActive) {
            this.redistributionActive = redistributionActive;
            return this;
        }

        public Builder registeredCount(final long registeredCount) {
            this.registeredCount = registeredCount;
            return this;
        }

        @NonNull
        public RewardsGlobals build() {
            return new RewardsGlobals(
                    redistributionPool, totalSupply, totalParticipationScore, redistributionActive, registeredCount);
        }
    }
}
