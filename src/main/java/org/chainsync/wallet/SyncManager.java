package org.chainsync.wallet;

import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Coin;
import org.chainsync.crosschain.ChainDataException;
import org.chainsync.crosschain.ChainDataProvider;
import org.chainsync.crosschain.DecoratedTransaction;
import org.chainsync.data.wallet.AccountSyncState;
import org.chainsync.data.wallet.AddressRecord;
import org.chainsync.data.wallet.Balance;
import org.chainsync.data.wallet.DerivedAddress;
import org.chainsync.data.wallet.LedgerBalance;
import org.chainsync.data.wallet.SyncState;
import org.chainsync.data.wallet.UtxoEntry;
import org.chainsync.data.wallet.WatchedScriptHash;
import org.chainsync.event.Event;
import org.chainsync.event.EventBus;
import org.chainsync.event.Listener;
import org.chainsync.event.NewBlockEvent;
import org.chainsync.event.NewTransactionEvent;
import org.chainsync.event.SyncEndEvent;
import org.chainsync.event.SyncedPathEvent;
import org.chainsync.event.WalletTransactionEvent;
import org.chainsync.repository.AddressRepository;
import org.chainsync.repository.DataException;
import org.chainsync.repository.SyncStateRepository;
import org.chainsync.repository.UtxoRepository;
import org.chainsync.settings.Settings;
import org.chainsync.utils.AmountUnit;
import org.chainsync.utils.Amounts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;

/**
 * Wallet sync engine.
 * <p>
 * Discovers used addresses of each account role by walking derivation paths until
 * <tt>gapLimit</tt> consecutive addresses have no history, and folds every history found
 * into per-address ledgers plus one aggregate ledger.
 * <p>
 * Folding is idempotent: each output and input is recorded by outpoint and never counted twice.
 * Folds for the same address are serialized; the per-address record and the aggregate are
 * committed together after each transaction.
 */
public class SyncManager {

	private static final Logger LOGGER = LogManager.getLogger(SyncManager.class);

	private static final int ADDRESS_LOCK_STRIPES = 64;

	private final ChainDataProvider provider;
	private final KeyPathManager keyManager;
	private final HdAccountIterator hdWallet;
	private final SyncStateRepository state;
	private final AddressRepository addresses;
	private final UtxoRepository utxos;

	private final int gapLimit;
	private final int minBlockConfirm;
	private final int maxScriptWatch;

	private volatile int currentBlock;

	private final AtomicBoolean syncing = new AtomicBoolean(false);
	private volatile boolean halted = false;

	private final Object ledgerLock = new Object();
	private LedgerBalance total = new LedgerBalance();

	private final Striped<Lock> addressLocks = Striped.lock(ADDRESS_LOCK_STRIPES);
	private final Object watchLock = new Object();
	private final ExecutorService historyExecutor;

	private final EventBus eventBus = new EventBus("Sync Manager");
	private final Listener providerListener = this::onProviderEvent;

	public SyncManager(ChainDataProvider provider, KeyPathManager keyManager, HdAccountIterator hdWallet,
			SyncStateRepository state, AddressRepository addresses, UtxoRepository utxos,
			Settings settings, int currentBlock) {
		this.provider = provider;
		this.keyManager = keyManager;
		this.hdWallet = hdWallet;
		this.state = state;
		this.addresses = addresses;
		this.utxos = utxos;

		this.gapLimit = settings.getGapLimit();
		this.minBlockConfirm = settings.getMinBlockConfirm();
		this.maxScriptWatch = settings.getMaxScriptWatch();
		this.currentBlock = currentBlock;

		this.historyExecutor = Executors.newCachedThreadPool(
				new ThreadFactoryBuilder().setNameFormat("Sync Manager History-%d").setDaemon(true).build());
	}

	public EventBus getEventBus() {
		return this.eventBus;
	}

	// Lifecycle

	/**
	 * Re-subscribes persisted watched addresses, loads aggregate ledger and opens stores.
	 */
	public void init() throws ChainDataException, DataException {
		this.provider.getEventBus().addListener(this.providerListener);

		for (AccountRole role : AccountRole.values())
			for (WatchedScriptHash watched : this.state.getWatchedScriptHashes(role))
				this.provider.subscribeToAddress(watched.getAddress());

		LedgerBalance persistedTotal = this.state.getTotalBalance();
		synchronized (this.ledgerLock) {
			if (persistedTotal != null)
				this.total = new LedgerBalance(persistedTotal);
		}

		this.addresses.init();
		this.utxos.init();
	}

	/**
	 * Zeroes aggregate ledger, clears halt flag and forgets scan positions.
	 */
	public void reset() throws DataException {
		LedgerBalance zero = new LedgerBalance();

		synchronized (this.ledgerLock) {
			this.state.setTotalBalance(zero);
			this.total = zero;
		}

		resumeSync();
		this.state.resetSyncState();
	}

	public void close() throws DataException {
		this.provider.getEventBus().removeListener(this.providerListener);
		this.historyExecutor.shutdownNow();

		this.addresses.close();
		this.utxos.close();
	}

	// Scanning

	public void stopSync() {
		this.halted = true;
	}

	public void resumeSync() {
		this.halted = false;
	}

	public boolean isStopped() {
		return this.halted;
	}

	public boolean isSyncing() {
		return this.syncing.get();
	}

	public void updateBlock(int height) throws SyncException {
		if (height <= 0)
			throw new SyncException("invalid block height " + height);

		this.currentBlock = height;
	}

	public int getCurrentBlock() {
		return this.currentBlock;
	}

	private static class ScanCursor {
		int gapCount;
		int gapEnd;

		ScanCursor(int gapCount, int gapEnd) {
			this.gapCount = gapCount;
			this.gapEnd = gapEnd;
		}
	}

	/**
	 * Scans <tt>role</tt> from its persisted position until the gap limit is reached or sync is stopped.
	 *
	 * @throws SyncException if a scan is already running or sync is stopped
	 */
	public void syncAccount(AccountRole role, SyncOptions options) throws SyncException, ChainDataException, DataException {
		if (this.halted || !this.syncing.compareAndSet(false, true))
			throw new SyncException(String.format("already syncing: halted %s, syncing %s", this.halted, this.syncing.get()));

		try {
			SyncState syncState = this.state.getSyncState(options);
			AccountSyncState accountState = syncState.get(role);

			if (accountState.getGap() >= this.gapLimit) {
				LOGGER.debug("{} gap limit {} already reached at {}", role, this.gapLimit, accountState.getPath());
				return;
			}

			ScanCursor cursor = new ScanCursor(accountState.getGap(), accountState.getGapEnd());

			this.hdWallet.eachAccount(role, accountState.getPath(), (path, halt) -> {
				if (this.halted || cursor.gapCount >= this.gapLimit) {
					halt.run();
					return;
				}

				boolean hasTransactions = processPath(path, cursor);

				// Don't hand out a receiving address that already has history
				if (hasTransactions)
					this.hdWallet.updateLastPath(DerivationPaths.bumpIndex(path));

				accountState.update(path, cursor.gapCount, cursor.gapEnd);
				this.state.setSyncState(syncState);

				this.eventBus.notify(new SyncedPathEvent(role, path, hasTransactions, cursor.gapCount, this.gapLimit, cursor.gapEnd));
			});

			if (this.halted) {
				LOGGER.info("{} sync halted at {}", role, accountState.getPath());
				this.eventBus.notify(new SyncEndEvent(role, true));
				return;
			}

			this.utxos.process();

			LOGGER.info("{} sync finished at {}, {} used addresses", role, accountState.getPath(), cursor.gapEnd);
			this.eventBus.notify(new SyncEndEvent(role, false));
		} finally {
			this.syncing.set(false);
		}
	}

	private boolean processPath(String path, ScanCursor cursor) throws ChainDataException, DataException {
		DerivedAddress derived = this.keyManager.pathToScriptHash(path, DerivationPaths.getAddressType(path));
		List<DecoratedTransaction> history = this.provider.getAddressHistory(derived.getAddress());

		if (history.isEmpty()) {
			cursor.gapCount++;
			return false;
		}

		processHistory(derived, history);
		cursor.gapEnd++;
		cursor.gapCount = 0;

		return true;
	}

	// Ledger

	/** Folds <tt>history</tt> into the ledger of <tt>derived</tt>. Safe to repeat. */
	public void processHistory(DerivedAddress derived, List<DecoratedTransaction> history) throws DataException {
		Lock lock = this.addressLocks.get(derived.getAddress());
		lock.lock();
		try {
			if (!this.addresses.get(derived.getAddress()).isPresent())
				this.addresses.newAddress(derived.getAddress());

			this.addresses.storeTxHistory(history);

			for (DecoratedTransaction transaction : history)
				foldTransaction(derived, transaction, getTxState(transaction));
		} finally {
			lock.unlock();
		}
	}

	TxState getTxState(DecoratedTransaction transaction) {
		if (transaction.height == 0)
			return TxState.MEMPOOL;

		if (this.currentBlock - transaction.height >= this.minBlockConfirm)
			return TxState.CONFIRMED;

		return TxState.PENDING;
	}

	// Call while holding address lock
	private void foldTransaction(DerivedAddress derived, DecoratedTransaction transaction, TxState txState) throws DataException {
		Optional<AddressRecord> stored = this.addresses.get(derived.getAddress());
		if (!stored.isPresent())
			return;

		AddressRecord record = new AddressRecord(stored.get());
		LedgerBalance delta = new LedgerBalance();
		List<UtxoEntry> entries = new ArrayList<>();

		for (DecoratedTransaction.Output output : transaction.outputs) {
			if (!derived.getAddress().equals(output.address))
				continue;

			if (!record.recordPoint(Direction.OUTPUT, output.getPoint()))
				continue;

			record.getLedger().getReceived().add(txState, output.value);
			record.getLedger().getFee().add(txState, transaction.fee);
			delta.getReceived().add(txState, output.value);

			entries.add(new UtxoEntry(output.txid, output.index, output.value, derived.getAddress(), derived.getPath(),
					derived.getPublicKey(), transaction.height, Direction.OUTPUT, txState, null));
		}

		for (DecoratedTransaction.Input input : transaction.inputs) {
			if (!derived.getAddress().equals(input.address))
				continue;

			if (!record.recordPoint(Direction.INPUT, input.getPoint()))
				continue;

			record.getLedger().getSpent().add(txState, input.value);
			delta.getSpent().add(txState, input.value);

			entries.add(new UtxoEntry(input.prevTxid, input.prevIndex, input.value, derived.getAddress(), derived.getPath(),
					derived.getPublicKey(), input.prevTxHeight, Direction.INPUT, txState, transaction.txid));
		}

		if (entries.isEmpty())
			return;

		synchronized (this.ledgerLock) {
			LedgerBalance newTotal = new LedgerBalance(this.total);
			newTotal.getReceived().add(delta.getReceived());
			newTotal.getSpent().add(delta.getSpent());

			this.addresses.set(record);
			this.state.setTotalBalance(newTotal);
			this.total = newTotal;
		}

		for (UtxoEntry entry : entries)
			this.utxos.add(entry);

		LOGGER.trace(() -> String.format("Folded %s into %s as %s: %s", transaction.txid, derived.getAddress(), txState, entries));
	}

	/**
	 * Returns spendable balance of <tt>address</tt>, or of the whole wallet if <tt>address</tt> is null.
	 *
	 * @throws SyncException if address has not been processed
	 */
	public Balance getBalance(String address) throws SyncException, DataException {
		LedgerBalance ledger;

		if (address == null) {
			synchronized (this.ledgerLock) {
				ledger = new LedgerBalance(this.total);
			}
		} else {
			Optional<AddressRecord> record = this.addresses.get(address);
			if (!record.isPresent())
				throw new SyncException("Address not valid or not processed for balance " + address);

			ledger = record.get().getLedger();
		}

		Balance received = ledger.getReceived();
		Balance spent = ledger.getSpent();

		Coin pending = spent.getPending().subtract(received.getPending());

		return new Balance(
				received.getConfirmed().subtract(spent.getConfirmed()),
				pending.isNegative() ? pending.negate() : pending,
				received.getMempool().subtract(spent.getMempool()));
	}

	public Balance getBalance() throws SyncException, DataException {
		return getBalance(null);
	}

	/** Returns copy of aggregate ledger. */
	public LedgerBalance getTotal() {
		synchronized (this.ledgerLock) {
			return new LedgerBalance(this.total);
		}
	}

	public void unlockUtxo(String lockId) throws DataException {
		this.utxos.unlock(lockId);
	}

	public List<UtxoEntry> utxoForAmount(Coin amount, String strategy) throws DataException {
		return this.utxos.getUtxoForAmount(amount, strategy);
	}

	public List<UtxoEntry> utxoForAmount(String amount, AmountUnit unit, String strategy) throws DataException {
		return utxoForAmount(Amounts.toCoin(amount, unit), strategy);
	}

	public void getTransactions(Consumer<DecoratedTransaction> consumer) throws DataException {
		this.addresses.getTransactions(consumer);
	}

	// Watched addresses

	/**
	 * Subscribes <tt>derived</tt> for new-transaction notifications, evicting the oldest
	 * watched address of <tt>role</tt> if the pool is full.
	 *
	 * @throws SyncException if the provider refused the subscription; nothing is persisted
	 */
	public void watchAddress(DerivedAddress derived, AccountRole role) throws SyncException, DataException {
		synchronized (this.watchLock) {
			List<WatchedScriptHash> watched = new ArrayList<>(this.state.getWatchedScriptHashes(role));

			WatchedScriptHash evicted = null;
			if (watched.size() >= this.maxScriptWatch)
				evicted = watched.remove(0);

			String handle;
			try {
				handle = this.provider.subscribeToAddress(derived.getAddress());
			} catch (ChainDataException e) {
				throw new SyncException("Failed to subscribe to address " + e.getMessage(), e);
			}

			watched.add(new WatchedScriptHash(derived, handle));
			this.state.addWatchedScriptHashes(watched, role);

			if (evicted != null && !isWatched(evicted.getAddress())) {
				LOGGER.debug("Evicted {} from {} watch pool", evicted.getAddress(), role);
				this.provider.unsubscribeFromAddress(evicted.getAddress());
			}
		}
	}

	// Call while holding watchLock
	private boolean isWatched(String address) throws DataException {
		for (AccountRole role : AccountRole.values())
			for (WatchedScriptHash watched : this.state.getWatchedScriptHashes(role))
				if (watched.getAddress().equals(address))
					return true;

		return false;
	}

	private void onProviderEvent(Event event) {
		if (event instanceof NewBlockEvent) {
			int height = ((NewBlockEvent) event).getHeight();
			if (height > this.currentBlock)
				this.currentBlock = height;

			return;
		}

		if (!(event instanceof NewTransactionEvent))
			return;

		NewTransactionEvent newTransactionEvent = (NewTransactionEvent) event;

		try {
			updateScriptHashBalance(newTransactionEvent);
			this.eventBus.notify(new WalletTransactionEvent(newTransactionEvent.getTxid()));
		} catch (ChainDataException | DataException e) {
			LOGGER.warn(String.format("Unable to update balances for transaction %s: %s", newTransactionEvent.getTxid(), e.getMessage()));
		}
	}

	/**
	 * Folds the notified transaction into the addresses it pays, refetches history of all other
	 * watched addresses, then retires the single-use internal pool.
	 */
	void updateScriptHashBalance(NewTransactionEvent event) throws ChainDataException, DataException {
		List<WatchedScriptHash> external = this.state.getWatchedScriptHashes(AccountRole.EXTERNAL);
		List<WatchedScriptHash> internal = this.state.getWatchedScriptHashes(AccountRole.INTERNAL);

		List<WatchedScriptHash> all = new ArrayList<>(external);
		all.addAll(internal);

		List<Callable<Void>> folds = new ArrayList<>();
		DecoratedTransaction notified = null;

		for (WatchedScriptHash watched : all) {
			if (event.getWatchedAddresses().contains(watched.getHandle())) {
				if (notified == null)
					notified = this.provider.getTransaction(event.getTxid(), ChainDataProvider.BYPASS_CACHE);

				processHistory(watched.getDerivedAddress(), Collections.singletonList(notified));
				continue;
			}

			folds.add(() -> {
				processHistory(watched.getDerivedAddress(), this.provider.getAddressHistory(watched.getAddress()));
				return null;
			});
		}

		List<Future<Void>> futures = new ArrayList<>(folds.size());
		for (Callable<Void> fold : folds)
			futures.add(this.historyExecutor.submit(fold));

		awaitAll(futures);

		retireInternal(internal);
	}

	/** Drops <tt>retired</tt> from the internal pool, keeping entries watched since they were read. */
	private void retireInternal(List<WatchedScriptHash> retired) throws DataException {
		synchronized (this.watchLock) {
			List<WatchedScriptHash> remaining = new ArrayList<>(this.state.getWatchedScriptHashes(AccountRole.INTERNAL));
			remaining.removeIf(current -> retired.stream().anyMatch(old -> isSameEntry(old, current)));

			this.state.addWatchedScriptHashes(remaining, AccountRole.INTERNAL);

			for (WatchedScriptHash watched : retired)
				if (!isWatched(watched.getAddress()))
					this.provider.unsubscribeFromAddress(watched.getAddress());
		}
	}

	private static boolean isSameEntry(WatchedScriptHash a, WatchedScriptHash b) {
		return a.getAddress().equals(b.getAddress()) && Objects.equals(a.getHandle(), b.getHandle());
	}

	private static void awaitAll(List<Future<Void>> futures) throws ChainDataException, DataException {
		for (Future<Void> future : futures) {
			try {
				future.get();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new DataException("interrupted while folding history", e);
			} catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof ChainDataException)
					throw (ChainDataException) cause;
				if (cause instanceof DataException)
					throw (DataException) cause;

				throw new DataException("unable to fold history", cause);
			}
		}
	}

}
