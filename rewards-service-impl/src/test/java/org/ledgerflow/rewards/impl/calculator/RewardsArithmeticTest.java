// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledgerflow.app.spi.workflows.ResponseCode.AMOUNT_OVERFLOW;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ledgerflow.app.spi.workflows.HandleException;

class RewardsArithmeticTest {

    @Test
    @DisplayName("mulDiv falls back to exact arithmetic when the product overflows")
    void mulDivOverflowingProduct() {
        assertThat(RewardsArithmetic.productWouldOverflow(Long.MAX_VALUE, 3)).isTrue();
        assertThat(RewardsArithmetic.mulDiv(Long.MAX_VALUE, 3, 4)).isEqualTo(6_917_529_027_641_081_855L);
        assertThat(RewardsArithmetic.mulDiv(7, 3, 2)).isEqualTo(10);
    }

    @Test
    @DisplayName("Quotients that do not fit in a long fail with AMOUNT_OVERFLOW")
    void quotientOverflow() {
        assertThatThrownBy(() -> RewardsArithmetic.mulDiv(Long.MAX_VALUE, 2, 1))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", AMOUNT_OVERFLOW);
        assertThatThrownBy(() -> RewardsArithmetic.mulDiv(Long.MAX_VALUE, 2, 3, 1, 1))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", AMOUNT_OVERFLOW);
    }

    @Test
    @DisplayName("Sums that overflow fail with AMOUNT_OVERFLOW")
    void exactOperations() {
        assertThat(RewardsArithmetic.addExact(1, 2)).isEqualTo(3);
        assertThatThrownBy(() -> RewardsArithmetic.addExact(Long.MAX_VALUE, 1))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", AMOUNT_OVERFLOW);
    }
}
