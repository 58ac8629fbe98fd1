// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.state.spi.WritableKVState;
import org.ledgerflow.state.spi.WritableStates;

/**
 * Provides write methods for modifying underlying data storage mechanisms for working with
 * accounts. Writes are buffered in the given {@link WritableStates} until their owner commits.
 */
public class WritableAccountStoreImpl extends ReadableAccountStoreImpl implements WritableAccountStore {

    public WritableAccountStoreImpl(@NonNull final WritableStates states) {
        super(states);
    }

    @Override
    protected WritableKVState<AccountId, Account> accountState() {
        return (WritableKVState<AccountId, Account>) super.accountState();
    }

    @Override
    public void put(@NonNull final Account account) {
        requireNonNull(account);
        accountState().put(account.accountId(), account);
    }

    @NonNull
    @Override
    public Set<AccountId> modifiedAccountsInState() {
        return accountState().modifiedKeys();
    }
}
