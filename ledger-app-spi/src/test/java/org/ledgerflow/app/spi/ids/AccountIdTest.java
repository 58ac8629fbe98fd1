// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.ids;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_ACCOUNT_ID;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ledgerflow.app.spi.workflows.HandleException;

class AccountIdTest {

    @Test
    @DisplayName("Negative account numbers are rejected")
    void rejectsNegative() {
        assertThatThrownBy(() -> AccountId.of(-1))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INVALID_ACCOUNT_ID);
    }

    @Test
    @DisplayName("Ids order by account number and print in shard.realm.num form")
    void orderingAndToString() {
        final List<AccountId> ids = new ArrayList<>(List.of(AccountId.of(1002), AccountId.of(2), AccountId.of(1001)));
        ids.sort(null);

        assertThat(ids).containsExactly(AccountId.of(2), AccountId.of(1001), AccountId.of(1002));
        assertThat(AccountId.of(2)).hasToString("0.0.2");
    }
}
