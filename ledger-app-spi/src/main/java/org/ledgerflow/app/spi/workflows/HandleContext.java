// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.workflows;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.store.StoreFactory;

/**
 * Everything a {@link TransactionHandler} can see while handling one operation: who is asking, at
 * which block height, and the stores to read and write.
 */
public interface HandleContext {

    /**
     * Returns the account on whose behalf the operation runs. Authentication of this account is
     * done by the host before the handler is called.
     *
     * @return the payer
     */
    @NonNull
    AccountId payer();

    /**
     * Returns the logical clock value supplied by the host for this operation.
     *
     * @return the current block height
     */
    long currentBlock();

    /**
     * Returns the factory of the stores visible to this operation. Writable stores share one set
     * of buffered states, committed only if the handler returns normally.
     *
     * @return the store factory
     */
    @NonNull
    StoreFactory storeFactory();
}
