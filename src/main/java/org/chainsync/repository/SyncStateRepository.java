package org.chainsync.repository;

import org.chainsync.data.wallet.LedgerBalance;
import org.chainsync.data.wallet.SyncState;
import org.chainsync.data.wallet.WatchedScriptHash;
import org.chainsync.wallet.AccountRole;
import org.chainsync.wallet.SyncOptions;

import java.util.List;

public interface SyncStateRepository {

	public List<WatchedScriptHash> getWatchedScriptHashes(AccountRole role) throws DataException;

	/** Replaces watched list for <tt>role</tt>. */
	public void addWatchedScriptHashes(List<WatchedScriptHash> watchedScriptHashes, AccountRole role) throws DataException;

	public SyncState getSyncState(SyncOptions options) throws DataException;

	public void setSyncState(SyncState syncState) throws DataException;

	/** Returns persisted aggregate ledger, or null if none saved yet. */
	public LedgerBalance getTotalBalance() throws DataException;

	public void setTotalBalance(LedgerBalance total) throws DataException;

	public void resetSyncState() throws DataException;

}
