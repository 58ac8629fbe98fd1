// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INSUFFICIENT_BALANCE;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_AMOUNT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_BLOCK_HEIGHT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.NOT_REGISTERED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.OK;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerflow.app.spi.workflows.HandleContext;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.app.spi.workflows.ResponseCode;
import org.ledgerflow.app.spi.workflows.TransactionHandler;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.impl.calculator.CumulativeHoldingsTracker;
import org.ledgerflow.rewards.impl.calculator.FeeSplitter;
import org.ledgerflow.rewards.impl.calculator.ParticipationScoreEngine;
import org.ledgerflow.rewards.impl.calculator.RewardsArithmetic;
import org.ledgerflow.rewards.impl.calculator.ScoreTransition;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.rewards.transaction.TransferTransactionBody;

/**
 * Handles a transfer between two registered accounts. The sender is debited the full amount, the
 * recipient is credited the amount net of the fee, and the fee moves into the redistribution pool.
 *
 * <p>Both parties then go through the same activity update, in this order: holdings accrue on the
 * balance held before the transfer, the balances move, the pool grows, the score takes one decay
 * or boost step, and the activity block advances. A transfer to oneself updates the single record
 * once, so the net effect on its balance is the loss of the fee.
 */
@Singleton
public class TransferHandler implements TransactionHandler<TransferTransactionBody, ResponseCode> {
    private static final Logger log = LogManager.getLogger(TransferHandler.class);

    private final FeeSplitter feeSplitter;
    private final CumulativeHoldingsTracker holdingsTracker;
    private final ParticipationScoreEngine scoreEngine;

    @Inject
    public TransferHandler(
            @NonNull final FeeSplitter feeSplitter,
            @NonNull final CumulativeHoldingsTracker holdingsTracker,
            @NonNull final ParticipationScoreEngine scoreEngine) {
        this.feeSplitter = requireNonNull(feeSplitter);
        this.holdingsTracker = requireNonNull(holdingsTracker);
        this.scoreEngine = requireNonNull(scoreEngine);
    }

    @Override
    public void pureChecks(@NonNull final TransferTransactionBody op) throws HandleException {
        requireNonNull(op);
        validateTrue(op.amount() > 0, INVALID_AMOUNT);
    }

    @NonNull
    @Override
    public ResponseCode handle(@NonNull final HandleContext context, @NonNull final TransferTransactionBody op)
            throws HandleException {
        requireNonNull(context);
        requireNonNull(op);
        validateTrue(context.payer().equals(op.sender()), UNAUTHORIZED);

        final var accountStore = context.storeFactory().writableStore(WritableAccountStore.class);
        final var globalsStore = context.storeFactory().writableStore(WritableRewardsGlobalsStore.class);
        final var sender = accountStore.getAccountById(op.sender());
        final var recipient = accountStore.getAccountById(op.recipient());
        validateTrue(sender != null && recipient != null, NOT_REGISTERED);

        final long currentBlock = context.currentBlock();
        validateTrue(currentBlock >= sender.lastActivityBlock(), INVALID_BLOCK_HEIGHT);
        validateTrue(currentBlock >= recipient.lastActivityBlock(), INVALID_BLOCK_HEIGHT);
        validateTrue(sender.balance() >= op.amount(), INSUFFICIENT_BALANCE);

        final long fee = feeSplitter.fee(op.amount());
        final long net = feeSplitter.net(op.amount());
        final var globals = globalsStore.get().copyBuilder();

        if (op.isSelfTransfer()) {
            final var updated = applyActivity(sender, sender.balance() - fee, currentBlock, globals);
            globals.redistributionPool(RewardsArithmetic.addExact(globalsStore.get().redistributionPool(), fee));
            accountStore.put(updated);
        } else {
            final long recipientBalance = RewardsArithmetic.addExact(recipient.balance(), net);
            final var updatedSender = applyActivity(sender, sender.balance() - op.amount(), currentBlock, globals);
            final var updatedRecipient = applyActivity(recipient, recipientBalance, currentBlock, globals);
            globals.redistributionPool(RewardsArithmetic.addExact(globalsStore.get().redistributionPool(), fee));
            accountStore.put(updatedSender);
            accountStore.put(updatedRecipient);
        }
        globalsStore.put(globals.build());
        log.debug(
                "Transferred {} from {} to {} at block {} (fee {})",
                op.amount(),
                op.sender(),
                op.recipient(),
                currentBlock,
                fee);
        return OK;
    }

    /**
     * Computes one party's record after a transfer and adds its score delta to the aggregate.
     */
    @NonNull
    private Account applyActivity(
            @NonNull final Account account,
            final long newBalance,
            final long currentBlock,
            @NonNull final RewardsGlobals.Builder globals) {
        final var holdings = holdingsTracker.accrue(account, currentBlock);
        final ScoreTransition transition =
                scoreEngine.onActivity(account.participationScore(), currentBlock - account.lastActivityBlock());
        scoreEngine.applyToTotal(globals, transition);
        log.debug(
                "{} score {} {} -> {}",
                account.accountId(),
                transition.kind(),
                transition.oldScore(),
                transition.newScore());
        return account.copyBuilder()
                .cumulativeHoldings(holdings)
                .balance(newBalance)
                .participationScore(transition.newScore())
                .lastActivityBlock(currentBlock)
                .build();
    }
}
