// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.BATCH_SIZE_LIMIT_EXCEEDED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_BLOCK_HEIGHT;
import static org.ledgerflow.app.spi.workflows.ResponseCode.NO_REWARDS;
import static org.ledgerflow.app.spi.workflows.ResponseCode.REDISTRIBUTION_LOCKED;
import static org.ledgerflow.app.spi.workflows.ResponseCode.REDISTRIBUTION_POOL_UNDERFLOW;
import static org.ledgerflow.app.spi.workflows.ResponseCode.UNAUTHORIZED;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.app.spi.workflows.HandleContext;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.app.spi.workflows.TransactionHandler;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.impl.calculator.ParticipationScoreEngine;
import org.ledgerflow.rewards.impl.calculator.PayoutQuote;
import org.ledgerflow.rewards.impl.calculator.RedistributionCalculator;
import org.ledgerflow.rewards.impl.calculator.RewardsArithmetic;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.rewards.transaction.AlgorithmicRedistributionTransactionBody;

/**
 * Handles a batch of algorithmic redistribution payouts.
 *
 * <p>The batch is gated as a whole: the payer must be the administrator, redistribution must be
 * active, and the pool must hold something. Beneficiaries are then priced and paid strictly in
 * list order against the pool and aggregate score as left by the previous payout, so the same
 * beneficiaries in a different order can receive different amounts. Unregistered or ineligible
 * beneficiaries receive zero and are left untouched.
 *
 * <p>A payout larger than what remains of the pool fails the batch with
 * {@link org.ledgerflow.app.spi.workflows.ResponseCode#REDISTRIBUTION_POOL_UNDERFLOW}; the payouts
 * already buffered by the batch are then discarded with the rest of the operation's writes.
 */
@Singleton
public class AlgorithmicRedistributionHandler
        implements TransactionHandler<AlgorithmicRedistributionTransactionBody, List<Long>> {
    private static final Logger log = LogManager.getLogger(AlgorithmicRedistributionHandler.class);

    private final RewardsConfig config;
    private final Authorizer authorizer;
    private final RedistributionCalculator calculator;
    private final ParticipationScoreEngine scoreEngine;

    @Inject
    public AlgorithmicRedistributionHandler(
            @NonNull final RewardsConfig config,
            @NonNull final Authorizer authorizer,
            @NonNull final RedistributionCalculator calculator,
            @NonNull final ParticipationScoreEngine scoreEngine) {
        this.config = requireNonNull(config);
        this.authorizer = requireNonNull(authorizer);
        this.calculator = requireNonNull(calculator);
        this.scoreEngine = requireNonNull(scoreEngine);
    }

    @Override
    public void pureChecks(@NonNull final AlgorithmicRedistributionTransactionBody op) throws HandleException {
        requireNonNull(op);
        validateTrue(op.beneficiaries().size() <= config.maxBatchSize(), BATCH_SIZE_LIMIT_EXCEEDED);
    }

    @NonNull
    @Override
    public List<Long> handle(
            @NonNull final HandleContext context, @NonNull final AlgorithmicRedistributionTransactionBody op)
            throws HandleException {
        requireNonNull(context);
        requireNonNull(op);
        validateTrue(authorizer.isSuperUser(context.payer()), UNAUTHORIZED);

        final var accountStore = context.storeFactory().writableStore(WritableAccountStore.class);
        final var globalsStore = context.storeFactory().writableStore(WritableRewardsGlobalsStore.class);
        validateTrue(globalsStore.get().redistributionActive(), REDISTRIBUTION_LOCKED);
        validateTrue(globalsStore.get().redistributionPool() > 0, NO_REWARDS);

        final long currentBlock = context.currentBlock();
        for (final var beneficiary : op.beneficiaries()) {
            final var account = accountStore.getAccountById(beneficiary);
            if (account != null) {
                validateTrue(currentBlock >= account.lastActivityBlock(), INVALID_BLOCK_HEIGHT);
                validateTrue(currentBlock >= account.lastClaimBlock(), INVALID_BLOCK_HEIGHT);
            }
        }

        final List<Long> payouts = new ArrayList<>(op.beneficiaries().size());
        long totalPaid = 0;
        for (final var beneficiary : op.beneficiaries()) {
            final var account = accountStore.getAccountById(beneficiary);
            if (account == null) {
                log.debug("Skipping unregistered beneficiary {}", beneficiary);
                payouts.add(0L);
                continue;
            }
            final var globals = globalsStore.get();
            final PayoutQuote quote = calculator.quote(globals, account, currentBlock);
            log.debug("Quote for {} at block {}: {}", beneficiary, currentBlock, quote);
            final long payout = quote.payout();
            if (payout > 0) {
                pay(accountStore, globalsStore, globals, account, payout, currentBlock);
                totalPaid += payout;
            }
            payouts.add(payout);
        }
        log.info(
                "Redistributed {} to {} beneficiaries at block {}, pool now {}",
                totalPaid,
                op.beneficiaries().size(),
                currentBlock,
                globalsStore.get().redistributionPool());
        return payouts;
    }

    private void pay(
            @NonNull final WritableAccountStore accountStore,
            @NonNull final WritableRewardsGlobalsStore globalsStore,
            @NonNull final RewardsGlobals globals,
            @NonNull final Account account,
            final long amount,
            final long currentBlock) {
        if (amount > globals.redistributionPool()) {
            throw new HandleException(
                    REDISTRIBUTION_POOL_UNDERFLOW,
                    "Payout " + amount + " to " + account.accountId() + " exceeds pool "
                            + globals.redistributionPool());
        }
        final var transition = scoreEngine.onClaim(account.participationScore());
        final var updatedGlobals = globals.copyBuilder().redistributionPool(globals.redistributionPool() - amount);
        scoreEngine.applyToTotal(updatedGlobals, transition);
        final var updatedAccount = account.copyBuilder()
                .balance(RewardsArithmetic.addExact(account.balance(), amount))
                .lastClaimBlock(currentBlock)
                .participationScore(transition.newScore())
                .build();

        accountStore.put(updatedAccount);
        globalsStore.put(updatedGlobals.build());
    }
}
