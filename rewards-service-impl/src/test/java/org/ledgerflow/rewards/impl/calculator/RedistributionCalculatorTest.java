// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.config.RewardsConfigLoader;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

class RedistributionCalculatorTest {

    private static final RewardsGlobals GLOBALS = new RewardsGlobals(1_000, 100_000, 10_000, true, 2);

    private RedistributionCalculator subject;

    @BeforeEach
    void setUp() {
        final RewardsConfig config = RewardsConfigLoader.defaults();
        subject = new RedistributionCalculator(config, new BaseShareCalculator(config));
    }

    @ParameterizedTest(name = "{0} blocks held -> {1}")
    @CsvSource({"0, 10000", "143, 10000", "144, 11000", "720, 15000", "1439, 19993", "1440, 20000", "100000, 20000"})
    @DisplayName("The time multiplier ramps linearly from the minimum holding period to its cap")
    void timeMultiplier(final long blocksHeld, final long expected) {
        assertThat(subject.timeMultiplier(blocksHeld)).isEqualTo(expected);
    }

    @Test
    @DisplayName("The cap holds for the longest possible holding")
    void timeMultiplierNeverOverflows() {
        assertThat(subject.timeMultiplier(Long.MAX_VALUE)).isEqualTo(20_000);
    }

    @Test
    @DisplayName("The velocity bonus applies only within two holding periods of the last claim")
    void velocityBonus() {
        assertThat(subject.velocityBonus(0)).isEqualTo(1_500);
        assertThat(subject.velocityBonus(287)).isEqualTo(1_500);
        assertThat(subject.velocityBonus(288)).isZero();
    }

    @Test
    @DisplayName("The adjusted share applies the multiplier and the bonus then truncates once")
    void adjustedShare() {
        assertThat(subject.adjustedShare(1_000, 20_000, 1_500)).isEqualTo(2_300);
        assertThat(subject.adjustedShare(999, 11_000, 0)).isEqualTo(1_098);
        assertThat(subject.adjustedShare(0, 20_000, 1_500)).isZero();
    }

    @Test
    @DisplayName("A long-held account that has not claimed recently gets a doubled base share")
    void eligibleQuote() {
        final var account = new Account(AccountId.of(1001), 50_000, 5_000, 0, 0, BigInteger.ZERO);

        final var quote = subject.quote(GLOBALS, account, 1_440);

        assertThat(quote.baseShare()).isEqualTo(500);
        assertThat(quote.timeMultiplier()).isEqualTo(20_000);
        assertThat(quote.velocityBonus()).isZero();
        assertThat(quote.adjustedShare()).isEqualTo(1_000);
        assertThat(quote.eligible()).isTrue();
        assertThat(quote.payout()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("A claim within the minimum holding period is not eligible")
    void recentClaimIsIneligible() {
        final var account = new Account(AccountId.of(1001), 50_000, 5_000, 0, 0, BigInteger.ZERO);

        final var quote = subject.quote(GLOBALS, account, 143);

        assertThat(quote.timeMultiplier()).isEqualTo(10_000);
        assertThat(quote.velocityBonus()).isEqualTo(1_500);
        assertThat(quote.adjustedShare()).isEqualTo(575);
        assertThat(quote.eligible()).isFalse();
        assertThat(quote.payout()).isZero();
    }

    @Test
    @DisplayName("A balance below a thousandth of the supply is not eligible")
    void smallHolderIsIneligible() {
        final var account = new Account(AccountId.of(1001), 99, 10_000, 0, 0, BigInteger.ZERO);

        final var quote = subject.quote(GLOBALS, account, 1_440);

        assertThat(quote.adjustedShare()).isPositive();
        assertThat(quote.eligible()).isFalse();
    }

    @Test
    @DisplayName("A zero share is not eligible")
    void zeroShareIsIneligible() {
        final var account = new Account(AccountId.of(1001), 0, 0, 0, 0, BigInteger.ZERO);
        final var emptySupply = GLOBALS.copyBuilder().totalSupply(0).build();

        assertThat(subject.quote(emptySupply, account, 1_440).eligible()).isFalse();
    }
}
