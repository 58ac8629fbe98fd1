// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.state;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * The state of one registered account. An account is registered exactly when a record for it
 * exists in the account state; records are never removed.
 *
 * @param accountId the id of the account
 * @param balance units of the fungible token held
 * @param participationScore the participation score, between zero and the configured maximum
 * @param lastActivityBlock the last block at which a transfer touched the account
 * @param lastClaimBlock the last block at which the account received a redistribution payout
 * @param cumulativeHoldings the running sum of balance times blocks held; unbounded
 */
public record Account(
        @NonNull AccountId accountId,
        long balance,
        long participationScore,
        long lastActivityBlock,
        long lastClaimBlock,
        @NonNull BigInteger cumulativeHoldings) {

    public Account {
        requireNonNull(accountId);
        requireNonNegative(balance, "balance");
        requireNonNegative(participationScore, "participationScore");
        requireNonNegative(lastActivityBlock, "lastActivityBlock");
        requireNonNegative(lastClaimBlock, "lastClaimBlock");
        requireNonNull(cumulativeHoldings);
        if (cumulativeHoldings.signum() < 0) {
            throw new IllegalArgumentException("cumulativeHoldings must be non-negative, was " + cumulativeHoldings);
        }
    }

    /**
     * Returns a builder initialized with the values of this account.
     *
     * @return the builder
     */
    @NonNull
    public Builder copyBuilder() {
        return new Builder(
                accountId, balance, participationScore, lastActivityBlock, lastClaimBlock, cumulativeHoldings);
    }

    /**
     * Returns a builder with every numeric field zero and no id.
     *
     * @return the builder
     */
    @NonNull
    public static Builder newBuilder() {
        return new Builder(null, 0, 0, 0, 0, BigInteger.ZERO);
    }

    private static void requireNonNegative(final long value, @NonNull final String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, was " + value);
        }
    }

    /**
     * Builder for {@link Account}.
     */
    public static final class Builder {
        private AccountId accountId;
        private long balance;
        private long participationScore;
        private long lastActivityBlock;
        private long lastClaimBlock;
        private BigInteger cumulativeHoldings;

        private Builder(
                final AccountId accountId,
                final long balance,
                final long participationScore,
                final long lastActivityBlock,
                final long lastClaimBlock,
                final BigInteger cumulativeHoldings) {
            this.accountId = accountId;
            this.balance = balance;
            this.participationScore = participationScore;
            this.lastActivityBlock = lastActivityBlock;
            this.lastClaimBlock = lastClaimBlock;
            this.cumulativeHoldings = cumulativeHoldings;
        }

        public Builder accountId(@NonNull final AccountId accountId) {
            this.accountId = requireNonNull(accountId);
            return this;
        }

        public Builder balance(final long balance) {
            this.balance = balance;
            return this;
        }

        public Builder participationScore(final long participationScore) {
            this.participationScore = participationScore;
            return this;
        }

        public Builder lastActivityBlock(final long lastActivityBlock) {
            this.lastActivityBlock = lastActivityBlock;
            return this;
        }

        public Builder lastClaimBlock(final long lastClaimBlock) {
            this.lastClaimBlock = lastClaimBlock;
            return this;
        }

        public Builder cumulativeHoldings(@NonNull final BigInteger cumulativeHoldings) {
            this.cumulativeHoldings = requireNonNull(cumulativeHoldings);
            return this;
        }

        @NonNull
        public Account build() {
            return new Account(
                    accountId, balance, participationScore, lastActivityBlock, lastClaimBlock, cumulativeHoldings);
        }
    }
}
