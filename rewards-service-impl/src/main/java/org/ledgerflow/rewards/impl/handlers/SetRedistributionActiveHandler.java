// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.app.spi.workflows.HandleContext;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.app.spi.workflows.TransactionHandler;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.transaction.SetRedistributionActiveTransactionBody;

/**
 * Handles the administrator switch that gates algorithmic redistribution.
 */
@Singleton
public class SetRedistributionActiveHandler
        implements TransactionHandler<SetRedistributionActiveTransactionBody, Boolean> {
    private static final Logger log = LogManager.getLogger(SetRedistributionActiveHandler.class);

    private final Authorizer authorizer;

    @Inject
    public SetRedistributionActiveHandler(@NonNull final Authorizer authorizer) {
        this.authorizer = requireNonNull(authorizer);
    }

    @NonNull
    @Override
    public Boolean handle(
            @NonNull final HandleContext context, @NonNull final SetRedistributionActiveTransactionBody op)
            throws HandleException {
        requireNonNull(context);
        requireNonNull(op);
        validateTrue(authorizer.isSuperUser(context.payer()), UNAUTHORIZED);

        final var globalsStore = context.storeFactory().writableStore(WritableRewardsGlobalsStore.class);
        globalsStore.put(globalsStore.get().copyBuilder().redistributionActive(op.active()).build());
        log.info(
                "Algorithmic redistribution {} at block {}",
                op.active() ? "enabled" : "disabled",
                context.currentBlock());
        return op.active();
    }
}
