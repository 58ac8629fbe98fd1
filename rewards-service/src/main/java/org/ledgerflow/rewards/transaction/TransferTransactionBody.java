// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.transaction;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Moves units from one account to another.
 *
 * @param amount the amount debited from the sender; the recipient is credited the amount net of the fee
 * @param sender the account debited
 * @param recipient the account credited
 */
public record TransferTransactionBody(long amount, @NonNull AccountId sender, @NonNull AccountId recipient) {
    public TransferTransactionBody {
        requireNonNull(sender);
        requireNonNull(recipient);
    }

    /**
     * Returns whether sender and recipient are the same account.
     *
     * @return true for a self transfer
     */
    public boolean isSelfTransfer() {
        return sender.equals(recipient);
    }
}
