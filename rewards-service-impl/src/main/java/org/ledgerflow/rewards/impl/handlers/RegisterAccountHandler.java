// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateFalse;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.ALREADY_REGISTERED;
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
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.impl.calculator.RewardsArithmetic;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.transaction.RegisterAccountTransactionBody;

/**
 * Handles account registration. A new account starts with no balance, the initial participation
 * score, and both its activity and claim blocks at the registration block. Setting the initial
 * score is not a score transition; it is added to the aggregate score directly.
 */
@Singleton
public class RegisterAccountHandler implements TransactionHandler<RegisterAccountTransactionBody, ResponseCode> {
    private static final Logger log = LogManager.getLogger(RegisterAccountHandler.class);

    private final RewardsConfig config;
    private final Authorizer authorizer;

    @Inject
    public RegisterAccountHandler(@NonNull final RewardsConfig config, @NonNull final Authorizer authorizer) {
        this.config = requireNonNull(config);
        this.authorizer = requireNonNull(authorizer);
    }

    @NonNull
    @Override
    public ResponseCode handle(@NonNull final HandleContext context, @NonNull final RegisterAccountTransactionBody op)
            throws HandleException {
        requireNonNull(context);
        requireNonNull(op);
        final var accountId = op.accountId();
        validateTrue(context.payer().equals(accountId) || authorizer.isSuperUser(context.payer()), UNAUTHORIZED);

        final var accountStore = context.storeFactory().writableStore(WritableAccountStore.class);
        final var globalsStore = context.storeFactory().writableStore(WritableRewardsGlobalsStore.class);
        validateFalse(accountStore.contains(accountId), ALREADY_REGISTERED);

        final var globals = globalsStore.get();
        final var updatedGlobals = globals.copyBuilder()
                .totalParticipationScore(RewardsArithmetic.addExact(
                        globals.totalParticipationScore(), config.initialParticipationScore()))
                .registeredCount(RewardsArithmetic.addExact(globals.registeredCount(), 1))
                .build();
        final var account = Account.newBuilder()
                .accountId(accountId)
                .participationScore(config.initialParticipationScore())
                .lastActivityBlock(context.currentBlock())
                .lastClaimBlock(context.currentBlock())
                .build();

        accountStore.put(account);
        globalsStore.put(updatedGlobals);
        log.debug("Registered {} at block {}", accountId, context.currentBlock());
        return OK;
    }
}
