// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INSUFFICIENT_BALANCE;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_AMOUNT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_BLOCK_HEIGHT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.NOT_REGISTERED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.rewards.impl.RewardsInvariants;
import org.ledgerflow.rewards.impl.calculator.CumulativeHoldingsTracker;
import org.ledgerflow.rewards.impl.calculator.FeeSplitter;
import org.ledgerflow.rewards.impl.calculator.ParticipationScoreEngine;
import org.ledgerflow.rewards.impl.test.RewardsHandlerTestBase;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.transaction.TransferTransactionBody;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransferHandlerTest extends RewardsHandlerTestBase {

    private FeeSplitter feeSplitter;

    private TransferHandler subject;

    @BeforeEach
    void setUp() {
        setupStates();
        feeSplitter = spy(new FeeSplitter(config));
        subject = new TransferHandler(
                feeSplitter, new CumulativeHoldingsTracker(), new ParticipationScoreEngine(config));
        givenAccount(account(ALICE, 1_000, 5_000, 100));
        givenAccount(account(BOB, 500, 5_000, 100));
    }

    @Test
    @DisplayName("pureChecks throws INVALID_AMOUNT for a zero amount")
    void pureChecksRejectsZero() {
        assertThatThrownBy(() -> subject.pureChecks(new TransferTransactionBody(0, ALICE, BOB)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INVALID_AMOUNT);
    }

    @Test
    @DisplayName("A transfer moves the net amount, funds the pool and boosts both parties")
    void transfers() {
        givenPayer(ALICE);
        givenStores(600);

        subject.handle(handleContext, new TransferTransactionBody(1_000, ALICE, BOB));

        // holdings accrue on the balances held during the 500 blocks before the transfer
        assertThat(accountOf(ALICE)).isEqualTo(new Account(ALICE, 0, 5_050, 600, 100, BigInteger.valueOf(500_000)));
        assertThat(accountOf(BOB)).isEqualTo(new Account(BOB, 1_480, 5_050, 600, 100, BigInteger.valueOf(250_000)));
        assertThat(globals().redistributionPool()).isEqualTo(20);
        assertThat(globals().totalParticipationScore()).isEqualTo(10_100);
        assertThat(globals().totalSupply()).isEqualTo(1_500);
        assertThat(RewardsInvariants.violations(writableAccountStore, writableGlobalsStore, 10_000))
                .isEmpty();
    }

    @Test
    @DisplayName("The recipient is credited with the net amount computed by the fee splitter")
    void creditsNetFromFeeSplitter() {
        givenPayer(ALICE);
        givenStores(600);
        given(feeSplitter.net(1_000)).willReturn(970L);

        subject.handle(handleContext, new TransferTransactionBody(1_000, ALICE, BOB));

        verify(feeSplitter).net(1_000);
        assertThat(accountOf(BOB).balance()).isEqualTo(500 + 970);
    }

    @Test
    @DisplayName("A large holder keeps transferring once cumulative holdings exceed the range of a long")
    void largeHolderTransfersPastLongHoldings() {
        final long balance = 1_000_000_000_000_000L;
        givenAccount(account(CAROL, balance, 5_000, 0));
        givenPayer(CAROL);
        givenStores(10_000);

        subject.handle(handleContext, new TransferTransactionBody(1_000, CAROL, BOB));

        final var expected = BigInteger.valueOf(balance).multiply(BigInteger.valueOf(10_000));
        assertThat(expected).isGreaterThan(BigInteger.valueOf(Long.MAX_VALUE));
        assertThat(accountOf(CAROL).cumulativeHoldings()).isEqualTo(expected);
        assertThat(accountOf(CAROL).balance()).isEqualTo(balance - 1_000);
        assertThat(accountOf(BOB).balance()).isEqualTo(500 + 980);
    }

    @Test
    @DisplayName("A transfer after more than 1000 idle blocks decays both parties")
    void decaysAfterIdlePeriod() {
        givenPayer(ALICE);
        givenStores(1_200);

        subject.handle(handleContext, new TransferTransactionBody(100, ALICE, BOB));

        assertThat(accountOf(ALICE).participationScore()).isEqualTo(4_500);
        assertThat(accountOf(BOB).participationScore()).isEqualTo(4_500);
        assertThat(accountOf(BOB).balance()).isEqualTo(500 + 98);
        assertThat(globals().totalParticipationScore()).isEqualTo(9_000);
        assertThat(globals().redistributionPool()).isEqualTo(2);
    }

    @Test
    @DisplayName("A second transfer in the same block boosts again exactly once per party")
    void oneTransitionPerTransfer() {
        givenPayer(ALICE);
        givenStores(600);

        subject.handle(handleContext, new TransferTransactionBody(100, ALICE, BOB));
        subject.handle(handleContext, new TransferTransactionBody(100, ALICE, BOB));

        assertThat(accountOf(ALICE).participationScore()).isEqualTo(5_100);
        assertThat(accountOf(ALICE).cumulativeHoldings()).isEqualTo(BigInteger.valueOf(500_000));
        assertThat(globals().totalParticipationScore()).isEqualTo(10_200);
    }

    @Test
    @DisplayName("A transfer to oneself updates the single record once and only pays the fee")
    void selfTransfer() {
        givenPayer(ALICE);
        givenStores(600);

        subject.handle(handleContext, new TransferTransactionBody(1_000, ALICE, ALICE));

        assertThat(accountOf(ALICE)).isEqualTo(new Account(ALICE, 980, 5_050, 600, 100, BigInteger.valueOf(500_000)));
        assertThat(globals().redistributionPool()).isEqualTo(20);
        assertThat(globals().totalParticipationScore()).isEqualTo(10_050);
        assertThat(RewardsInvariants.violations(writableAccountStore, writableGlobalsStore, 10_000))
                .isEmpty();
    }

    @Test
    @DisplayName("handle throws UNAUTHORIZED when the payer is not the sender")
    void rejectsNonSender() {
        givenPayer(BOB);

        assertThatThrownBy(() -> subject.handle(handleContext, new TransferTransactionBody(10, ALICE, BOB)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", UNAUTHORIZED);
    }

    @Test
    @DisplayName("handle throws NOT_REGISTERED for an unknown recipient")
    void rejectsUnknownRecipient() {
        givenPayer(ALICE);
        givenStoresOnly();

        assertThatThrownBy(() -> subject.handle(handleContext, new TransferTransactionBody(10, ALICE, CAROL)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", NOT_REGISTERED);
    }

    @Test
    @DisplayName("handle throws INSUFFICIENT_BALANCE and writes nothing")
    void rejectsOverdraft() {
        givenPayer(ALICE);
        givenStores(600);

        assertThatThrownBy(() -> subject.handle(handleContext, new TransferTransactionBody(1_001, ALICE, BOB)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INSUFFICIENT_BALANCE);
        assertThat(writableAccountStore.modifiedAccountsInState()).isEmpty();
        assertThat(globals().redistributionPool()).isZero();
    }

    @Test
    @DisplayName("handle throws INVALID_BLOCK_HEIGHT when the clock is behind the last activity")
    void rejectsClockRegression() {
        givenPayer(ALICE);
        givenStores(99);

        assertThatThrownBy(() -> subject.handle(handleContext, new TransferTransactionBody(10, ALICE, BOB)))
                .isInstanceOf(HandleException.class)
                .hasFieldOrPropertyWithValue("status", INVALID_BLOCK_HEIGHT);
        assertThat(writableAccountStore.modifiedAccountsInState()).isEmpty();
    }
}
