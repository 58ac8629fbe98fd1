// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.impl.test.RewardsTestBase;

class RewardsStoreFactoryTest extends RewardsTestBase {

    private RewardsStoreFactory subject;

    @BeforeEach
    void setUp() {
        setupStates();
        givenAccount(account(ALICE, 100, 5_000, 0));
        subject = new RewardsStoreFactory(state.getReadableStates(), state.getWritableStates());
    }

    @Test
    @DisplayName("Readable stores see committed accounts and globals")
    void readableStores() {
        final var accountStore = subject.readableStore(ReadableAccountStore.class);
        final var globalsStore = subject.readableStore(ReadableRewardsGlobalsStore.class);

        assertThat(accountStore).isInstanceOf(ReadableAccountStoreImpl.class);
        assertThat(accountStore.getAccountById(ALICE)).isEqualTo(accountOf(ALICE));
        assertThat(accountStore.getAccountById(BOB)).isNull();
        assertThat(globalsStore.get().totalSupply()).isEqualTo(100);
    }

    @Test
    @DisplayName("Writes through a writable store stay invisible to readable stores until committed")
    void writableStoreBuffers() {
        final var writable = subject.writableStore(WritableAccountStore.class);
        writable.put(account(BOB, 50, 5_000, 0));

        assertThat(writable.getAccountById(BOB)).isNotNull();
        assertThat(subject.readableStore(ReadableAccountStore.class).getAccountById(BOB))
                .isNull();
    }

    @Test
    @DisplayName("Unknown store types are rejected")
    void unknownStoreType() {
        assertThatThrownBy(() -> subject.readableStore(WritableAccountStore.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> subject.writableStore(ReadableAccountStore.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
