// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema.ACCOUNTS_STATE_ID;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.state.spi.ReadableKVState;
import org.ledgerflow.state.spi.ReadableStates;

/**
 * Default implementation of {@link ReadableAccountStore}.
 */
public class ReadableAccountStoreImpl implements ReadableAccountStore {

    /** The underlying data storage class that holds the account data. */
    private final ReadableKVState<AccountId, Account> accountState;

    /**
     * Create a new {@link ReadableAccountStoreImpl} instance.
     *
     * @param states The state to use.
     */
    public ReadableAccountStoreImpl(@NonNull final ReadableStates states) {
        this.accountState = requireNonNull(states).get(ACCOUNTS_STATE_ID);
    }

    /**
     * Returns the underlying account state; subclasses narrow the type.
     *
     * @return the account state
     */
    protected ReadableKVState<AccountId, Account> accountState() {
        return accountState;
    }

    @Override
    @Nullable
    public Account getAccountById(@NonNull final AccountId accountId) {
        return accountState.get(requireNonNull(accountId));
    }

    @NonNull
    @Override
    public Iterator<AccountId> accountIds() {
        return accountState.keys();
    }

    @Override
    public long sizeOfAccountState() {
        return accountState.size();
    }
}
