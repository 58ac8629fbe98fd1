// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.store.StoreFactory;
import org.ledgerflow.app.spi.workflows.HandleContext;

/**
 * The {@link HandleContext} of one rewards service operation.
 *
 * @param payer the authenticated caller
 * @param currentBlock the block height supplied by the host
 * @param storeFactory the stores of the operation
 */
public record RewardsHandleContext(@NonNull AccountId payer, long currentBlock, @NonNull StoreFactory storeFactory)
        implements HandleContext {

    public RewardsHandleContext {
        requireNonNull(payer);
        requireNonNull(storeFactory);
    }
}
