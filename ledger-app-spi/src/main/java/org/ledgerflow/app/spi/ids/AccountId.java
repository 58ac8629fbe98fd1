// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.ids;

import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_ACCOUNT_ID;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Identifies an account by its number.
 *
 * @param accountNum the non-negative account number
 */
public record AccountId(long accountNum) implements Comparable<AccountId> {

    public AccountId {
        validateTrue(accountNum >= 0, INVALID_ACCOUNT_ID);
    }

    /**
     * Creates an id from an account number.
     *
     * @param accountNum the account number
     * @return the id
     */
    public static AccountId of(final long accountNum) {
        return new AccountId(accountNum);
    }

    @Override
    public int compareTo(@NonNull final AccountId other) {
        return Long.compare(accountNum, other.accountNum);
    }

    @Override
    public String toString() {
        return "0.0." + accountNum;
    }
}
