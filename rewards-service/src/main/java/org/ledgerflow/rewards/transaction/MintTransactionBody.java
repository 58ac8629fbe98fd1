// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.transaction;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Mints new units.
 *
 * @param amount the amount to mint
 * @param recipient the account credited
 */
public record MintTransactionBody(long amount, @NonNull AccountId recipient) {
    public MintTransactionBody {
        requireNonNull(recipient);
    }
}
