// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.transaction;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Registers an account.
 *
 * @param accountId the account to register
 */
public record RegisterAccountTransactionBody(@NonNull AccountId accountId) {
    public RegisterAccountTransactionBody {
        requireNonNull(accountId);
    }
}
