// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.state.Account;

class CumulativeHoldingsTrackerTest {

    private final CumulativeHoldingsTracker subject = new CumulativeHoldingsTracker();

    private final Account account = new Account(AccountId.of(1001), 100, 5_000, 10, 0, BigInteger.valueOf(50));

    @Test
    @DisplayName("Holdings grow by the balance held times the blocks since the last activity")
    void accrues() {
        assertThat(subject.accrue(account, 25)).isEqualTo(BigInteger.valueOf(50 + 100 * 15));
    }

    @Test
    @DisplayName("No blocks held adds nothing")
    void sameBlock() {
        assertThat(subject.accrue(account, 10)).isEqualTo(BigInteger.valueOf(50));
    }

    @Test
    @DisplayName("A block before the last activity is rejected")
    void rejectsEarlierBlock() {
        assertThatThrownBy(() -> subject.accrue(account, 9)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Holdings keep growing past the range of a long")
    void growsBeyondLongRange() {
        final var rich = account.copyBuilder().balance(Long.MAX_VALUE / 2).build();

        final var expected = BigInteger.valueOf(Long.MAX_VALUE / 2)
                .multiply(BigInteger.valueOf(3))
                .add(BigInteger.valueOf(50));
        assertThat(subject.accrue(rich, 13)).isEqualTo(expected);
    }
}
