// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.state.Account;

/**
 * Provides read-only methods for interacting with the underlying data storage mechanisms for
 * working with accounts.
 */
public interface ReadableAccountStore {

    /**
     * Returns the account with the given id, or {@code null} if the account is not registered.
     * A missing account is never materialized by a read.
     *
     * @param accountId the id of the account
     * @return the account, or null
     */
    @Nullable
    Account getAccountById(@NonNull AccountId accountId);

    /**
     * Returns whether the given account is registered.
     *
     * @param accountId the id of the account
     * @return true if a record exists
     */
    default boolean contains(@NonNull final AccountId accountId) {
        return getAccountById(accountId) != null;
    }

    /**
     * Returns the ids of all registered accounts.
     *
     * @return an iterator over the account ids
     */
    @NonNull
    Iterator<AccountId> accountIds();

    /**
     * Returns the number of accounts in state.
     *
     * @return the number of accounts
     */
    long sizeOfAccountState();
}
