// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.app.spi.workflows.HandleException.validateTrue;
import static org.ledgerflow.app.spi.workflows.ResponseCode.INVALID_BLOCK_HEIGHT;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.app.spi.workflows.TransactionHandler;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.RewardsService;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.impl.calculator.BaseShareCalculator;
import org.ledgerflow.rewards.impl.codec.RewardsStateCodec;
import org.ledgerflow.rewards.impl.handlers.RewardsHandlers;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;
import org.ledgerflow.rewards.transaction.AlgorithmicRedistributionTransactionBody;
import org.ledgerflow.rewards.transaction.MintTransactionBody;
import org.ledgerflow.rewards.transaction.RegisterAccountTransactionBody;
import org.ledgerflow.rewards.transaction.SetRedistributionActiveTransactionBody;
import org.ledgerflow.rewards.transaction.TransferTransactionBody;
import org.ledgerflow.state.memory.InMemoryState;

/**
 * Default implementation of {@link RewardsService} over an {@link InMemoryState} that has the
 * {@link org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema} states registered.
 *
 * <p>Each mutating call takes the write lock, hands a fresh set of buffered writable states to the
 * operation's handler, and commits the buffers only if the handler returns normally. Any exception
 * discards them. Queries take the read lock and see committed state only.
 *
 * <p>With debug logging enabled for this class, the account state is recounted against the global
 * counters before every commit, and an inconsistent result is discarded.
 */
@Singleton
public class RewardsServiceImpl implements RewardsService {
    private static final Logger log = LogManager.getLogger(RewardsServiceImpl.class);

    private final InMemoryState state;
    private final RewardsConfig config;
    private final RewardsHandlers handlers;
    private final BaseShareCalculator baseShareCalculator;
    private final RewardsStateCodec codec;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Inject
    public RewardsServiceImpl(
            @NonNull final InMemoryState state,
            @NonNull final RewardsConfig config,
            @NonNull final RewardsHandlers handlers,
            @NonNull final BaseShareCalculator baseShareCalculator,
            @NonNull final RewardsStateCodec codec) {
        this.state = requireNonNull(state);
        this.config = requireNonNull(config);
        this.handlers = requireNonNull(handlers);
        this.baseShareCalculator = requireNonNull(baseShareCalculator);
        this.codec = requireNonNull(codec);
    }

    @Override
    public void register(@NonNull final AccountId caller, final long currentBlock, @NonNull final AccountId accountId) {
        dispatch(
                caller,
                currentBlock,
                handlers.registerAccountHandler(),
                new RegisterAccountTransactionBody(accountId));
    }

    @Override
    public void mint(
            @NonNull final AccountId caller,
            final long currentBlock,
            final long amount,
            @NonNull final AccountId recipient) {
        dispatch(caller, currentBlock, handlers.mintHandler(), new MintTransactionBody(amount, recipient));
    }

    @Override
    public void transfer(
            @NonNull final AccountId caller,
            final long currentBlock,
            final long amount,
            @NonNull final AccountId sender,
            @NonNull final AccountId recipient) {
        dispatch(
                caller,
                currentBlock,
                handlers.transferHandler(),
                new TransferTransactionBody(amount, sender, recipient));
    }

    @Override
    public boolean setRedistributionActive(
            @NonNull final AccountId caller, final long currentBlock, final boolean active) {
        return dispatch(
                caller,
                currentBlock,
                handlers.setRedistributionActiveHandler(),
                new SetRedistributionActiveTransactionBody(active));
    }

    @NonNull
    @Override
    public List<Long> executeAlgorithmicRedistribution(
            @NonNull final AccountId caller, final long currentBlock, @NonNull final List<AccountId> beneficiaries) {
        return dispatch(
                caller,
                currentBlock,
                handlers.algorithmicRedistributionHandler(),
                new AlgorithmicRedistributionTransactionBody(beneficiaries));
    }

    @Override
    public long getBalance(@NonNull final AccountId accountId) {
        return getAccount(accountId).map(Account::balance).orElse(0L);
    }

    @Override
    public long getParticipationScore(@NonNull final AccountId accountId) {
        return getAccount(accountId).map(Account::participationScore).orElse(0L);
    }

    @NonNull
    @Override
    public BigInteger getCumulativeHoldings(@NonNull final AccountId accountId) {
        return getAccount(accountId).map(Account::cumulativeHoldings).orElse(BigInteger.ZERO);
    }

    @Override
    public long getPendingRewards(@NonNull final AccountId accountId) {
        requireNonNull(accountId);
        return read(stores -> {
            final var account = stores.accountStore().getAccountById(accountId);
            return account == null ? 0L : baseShareCalculator.baseShare(stores.globalsStore().get(), account);
        });
    }

    @NonNull
    @Override
    public Optional<Account> getAccount(@NonNull final AccountId accountId) {
        requireNonNull(accountId);
        return read(stores -> Optional.ofNullable(stores.accountStore().getAccountById(accountId)));
    }

    @Override
    public long getRedistributionPool() {
        return globals().redistributionPool();
    }

    @Override
    public long getTotalSupply() {
        return globals().totalSupply();
    }

    @Override
    public long getTotalParticipationScore() {
        return globals().totalParticipationScore();
    }

    @Override
    public boolean isRedistributionActive() {
        return globals().redistributionActive();
    }

    @Override
    public long getRegisteredCount() {
        return globals().registeredCount();
    }

    /**
     * Returns a JSON snapshot of the committed state.
     *
     * @return the snapshot
     */
    @NonNull
    public String exportSnapshot() {
        return read(stores -> codec.encode(stores.accountStore(), stores.globalsStore()));
    }

    /**
     * Loads a JSON snapshot into a state that has no accounts yet.
     *
     * @param json the snapshot
     * @throws IllegalArgumentException if the snapshot is malformed or inconsistent
     * @throws IllegalStateException if accounts are already registered
     */
    public void importSnapshot(@NonNull final String json) {
        final var snapshot = codec.decode(requireNonNull(json));
        final var violations =
                RewardsInvariants.violations(snapshot.accounts(), snapshot.globals(), config.maxParticipationScore());
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Inconsistent rewards snapshot: " + String.join("; ", violations));
        }
        lock.writeLock().lock();
        try {
            final var writableStates = state.getWritableStates();
            final var storeFactory = new RewardsStoreFactory(state.getReadableStates(), writableStates);
            final var accountStore = storeFactory.writableStore(WritableAccountStore.class);
            if (accountStore.sizeOfAccountState() > 0) {
                throw new IllegalStateException("Cannot import a snapshot over " + accountStore.sizeOfAccountState()
                        + " registered accounts");
            }
            snapshot.accounts().forEach(accountStore::put);
            storeFactory.writableStore(WritableRewardsGlobalsStore.class).put(snapshot.globals());
            writableStates.commit();
            log.info("Imported {} accounts from snapshot", snapshot.accounts().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <B, R> R dispatch(
            @NonNull final AccountId caller,
            final long currentBlock,
            @NonNull final TransactionHandler<B, R> handler,
            @NonNull final B body) {
        requireNonNull(caller);
        validateTrue(currentBlock >= 0, INVALID_BLOCK_HEIGHT);
        lock.writeLock().lock();
        try {
            final var writableStates = state.getWritableStates();
            final var storeFactory = new RewardsStoreFactory(state.getReadableStates(), writableStates);
            try {
                handler.pureChecks(body);
                final R result = handler.handle(new RewardsHandleContext(caller, currentBlock, storeFactory), body);
                if (log.isDebugEnabled()) {
                    RewardsInvariants.verify(
                            storeFactory.writableStore(WritableAccountStore.class),
                            storeFactory.writableStore(WritableRewardsGlobalsStore.class),
                            config.maxParticipationScore());
                }
                writableStates.commit();
                return result;
            } catch (final HandleException e) {
                writableStates.reset();
                log.warn(
                        "{} by {} at block {} failed: {}",
                        body.getClass().getSimpleName(),
                        caller,
                        currentBlock,
                        e.getMessage());
                throw e;
            } catch (final RuntimeException e) {
                writableStates.reset();
                log.error("{} by {} at block {} aborted", body.getClass().getSimpleName(), caller, currentBlock, e);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @NonNull
    private RewardsGlobals globals() {
        return read(ReadStores::globals);
    }

    private <T> T read(@NonNull final Function<ReadStores, T> query) {
        lock.readLock().lock();
        try {
            final var storeFactory = new RewardsStoreFactory(state.getReadableStates(), state.getWritableStates());
            return query.apply(new ReadStores(
                    storeFactory.readableStore(ReadableAccountStore.class),
                    storeFactory.readableStore(ReadableRewardsGlobalsStore.class)));
        } finally {
            lock.readLock().unlock();
        }
    }

    private record ReadStores(
            @NonNull ReadableAccountStore accountStore, @NonNull ReadableRewardsGlobalsStore globalsStore) {
        RewardsGlobals globals() {
            return globalsStore.get();
        }
    }
}
