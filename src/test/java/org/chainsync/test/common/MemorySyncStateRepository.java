package org.chainsync.test.common;

import org.chainsync.data.wallet.AccountSyncState;
import org.chainsync.data.wallet.LedgerBalance;
import org.chainsync.data.wallet.SyncState;
import org.chainsync.data.wallet.WatchedScriptHash;
import org.chainsync.repository.SyncStateRepository;
import org.chainsync.wallet.AccountRole;
import org.chainsync.wallet.SyncOptions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MemorySyncStateRepository implements SyncStateRepository {

	private final Map<AccountRole, List<WatchedScriptHash>> watched = new EnumMap<>(AccountRole.class);
	private SyncState syncState = new SyncState();
	private LedgerBalance total = null;

	public int totalWrites = 0;

	@Override
	public synchronized List<WatchedScriptHash> getWatchedScriptHashes(AccountRole role) {
		return new ArrayList<>(this.watched.getOrDefault(role, new ArrayList<>()));
	}

	@Override
	public synchronized void addWatchedScriptHashes(List<WatchedScriptHash> watchedScriptHashes, AccountRole role) {
		this.watched.put(role, new ArrayList<>(watchedScriptHashes));
	}

	@Override
	public synchronized SyncState getSyncState(SyncOptions options) {
		if (options.isRestart())
			return new SyncState();

		return copy(this.syncState);
	}

	@Override
	public synchronized void setSyncState(SyncState syncState) {
		this.syncState = copy(syncState);
	}

	@Override
	public synchronized LedgerBalance getTotalBalance() {
		return this.total == null ? null : new LedgerBalance(this.total);
	}

	@Override
	public synchronized void setTotalBalance(LedgerBalance total) {
		this.total = new LedgerBalance(total);
		this.totalWrites++;
	}

	@Override
	public synchronized void resetSyncState() {
		this.syncState = new SyncState();
	}

	private static SyncState copy(SyncState syncState) {
		SyncState copy = new SyncState();

		for (AccountRole role : AccountRole.values()) {
			AccountSyncState account = syncState.get(role);
			copy.set(role, new AccountSyncState(account.getPath(), account.getGap(), account.getGapEnd()));
		}

		return copy;
	}
}
