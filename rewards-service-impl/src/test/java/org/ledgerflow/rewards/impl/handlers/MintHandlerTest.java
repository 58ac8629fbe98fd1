// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledgerflow.app.spi.workflows.ResponseCode.AMOUNT_OVERFLOW;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_AMOUNT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.NOT_REGISTERED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;
import static org.mockito.BDDMockito.given;

import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.rewards.impl.test.RewardsHandlerTestBase;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.transaction.MintTransactionBody;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MintHandlerTest extends RewardsHandlerTestBase {

    @Mock
    private Authorizer authorizer;

    private MintHandler subject;

    @BeforeEach
    void setUp() {
        setupStates();
        subject = new MintHandler(authorizer);
    }

    @Test
    @DisplayName("pureChecks throws INVALID_AMOUNT for zero and negative amounts")
    void pureChecksRejectsNonPositive() {
        assertThatThrownBy(() -> subject.pureChecks(new MintTransactionBody(0, ALICE)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INVALID_AMOUNT);
        assertThatThrownBy(() -> subject.pureChecks(new MintTransactionBody(-5, ALICE)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INVALID_AMOUNT);
    }

    @Test
    @DisplayName("handle throws UNAUTHORIZED when the payer is not the administrator")
    void rejectsNonAdmin() {
        givenPayer(ALICE);
        given(authorizer.isSuperUser(ALICE)).willReturn(false);

        assertThatThrownBy(() -> subject.handle(handleContext, new MintTransactionBody(10, ALICE)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", UNAUTHORIZED);
    }

    @Test
    @DisplayName("handle throws NOT_REGISTERED for an unknown recipient")
    void rejectsUnknownRecipient() {
        givenPayer(ADMIN);
        given(authorizer.isSuperUser(ADMIN)).willReturn(true);
        givenStoresOnly();

        assertThatThrownBy(() -> subject.handle(handleContext, new MintTransactionBody(10, CAROL)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", NOT_REGISTERED);
        assertThat(writableAccountStore.getAccountById(CAROL)).isNull();
    }

    @Test
    @DisplayName("Minting credits the recipient and the supply and nothing else")
    void mints() {
        givenAccount(new Account(ALICE, 100, 5_000, 10, 10, BigInteger.valueOf(40)));
        givenPayer(ADMIN);
        given(authorizer.isSuperUser(ADMIN)).willReturn(true);
        givenStoresOnly();

        subject.handle(handleContext, new MintTransactionBody(50, ALICE));

        assertThat(accountOf(ALICE)).isEqualTo(new Account(ALICE, 150, 5_000, 10, 10, BigInteger.valueOf(40)));
        assertThat(globals().totalSupply()).isEqualTo(150);
        assertThat(globals().totalParticipationScore()).isEqualTo(5_000);
        assertThat(globals().redistributionPool()).isZero();
    }

    @Test
    @DisplayName("handle throws AMOUNT_OVERFLOW when the supply would overflow")
    void rejectsOverflow() {
        givenAccount(new Account(ALICE, Long.MAX_VALUE - 10, 5_000, 0, 0, BigInteger.ZERO));
        givenPayer(ADMIN);
        given(authorizer.isSuperUser(ADMIN)).willReturn(true);
        givenStoresOnly();

        assertThatThrownBy(() -> subject.handle(handleContext, new MintTransactionBody(11, ALICE)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", AMOUNT_OVERFLOW);
        assertThat(writableAccountStore.modifiedAccountsInState()).isEmpty();
    }
}
