// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_AMOUNT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.NOT_REGISTERED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.OK;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.app.spi.workflows.HandleContext;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.app.spi.workflows.ResponseCode;
import org.ledgerflow.app.spi.workflows.TransactionHandler;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.impl.calculator.RewardsArithmetic;
import org.ledgerflow.rewards.transaction.MintTransactionBody;

/**
 * Handles minting: credits the recipient and grows the total supply by the same amount. Minting is
 * not activity; it leaves the recipient's score, holdings and activity block alone.
 */
@Singleton
public class MintHandler implements TransactionHandler<MintTransactionBody, ResponseCode> {
    private static final Logger log = LogManager.getLogger(MintHandler.class);

    private final Authorizer authorizer;

    @Inject
    public MintHandler(@NonNull final Authorizer authorizer) {
        this.authorizer = requireNonNull(authorizer);
    }

    @Override
    public void pureChecks(@NonNull final MintTransactionBody op) throws HandleException {
        requireNonNull(op);
        validateTrue(op.amount() > 0, INVALID_AMOUNT);
    }

    @NonNull
    @Override
    public ResponseCode handle(@NonNull final HandleContext context, @NonNull final MintTransactionBody op)
            throws HandleException {
        requireNonNull(context);
        requireNonNull(op);
        validateTrue(authorizer.isSuperUser(context.payer()), UNAUTHORIZED);

        final var accountStore = context.storeFactory().writableStore(WritableAccountStore.class);
        final var globalsStore = context.storeFactory().writableStore(WritableRewardsGlobalsStore.class);
        final var recipient = accountStore.getAccountById(op.recipient());
        validateTrue(recipient != null, NOT_REGISTERED);

        final var globals = globalsStore.get();
        final var updatedRecipient = recipient
                .copyBuilder()
                .balance(RewardsArithmetic.addExact(recipient.balance(), op.amount()))
                .build();
        final var updatedGlobals = globals.copyBuilder()
                .totalSupply(RewardsArithmetic.addExact(globals.totalSupply(), op.amount()))
                .build();

        accountStore.put(updatedRecipient);
        globalsStore.put(updatedGlobals);
        log.info("Minted {} to {}, total supply now {}", op.amount(), op.recipient(), updatedGlobals.totalSupply());
        return OK;
    }
}
