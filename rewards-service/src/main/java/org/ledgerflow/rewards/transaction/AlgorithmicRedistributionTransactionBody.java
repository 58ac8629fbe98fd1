// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.transaction;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Runs one batch of algorithmic redistribution.
 *
 * @param beneficiaries the accounts to pay, processed in this order; duplicates are processed twice
 */
public record AlgorithmicRedistributionTransactionBody(@NonNull List<AccountId> beneficiaries) {
    public AlgorithmicRedistributionTransactionBody {
        beneficiaries = List.copyOf(beneficiaries);
    }
}
