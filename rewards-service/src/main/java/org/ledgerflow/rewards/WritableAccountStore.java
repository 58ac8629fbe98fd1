// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.state.Account;

/**
 * Provides write methods for modifying the account state.
 */
public interface WritableAccountStore extends ReadableAccountStore {

    /**
     * Persists an updated {@link Account}. If an account with the same id already exists, it is
     * overwritten.
     *
     * @param account the account to persist
     */
    void put(@NonNull Account account);

    /**
     * Returns the ids of the accounts modified by the current operation.
     *
     * @return the modified account ids
     */
    @NonNull
    Set<AccountId> modifiedAccountsInState();
}
