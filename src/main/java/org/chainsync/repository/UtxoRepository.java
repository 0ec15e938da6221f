package org.chainsync.repository;

import org.bitcoinj.core.Coin;
import org.chainsync.data.wallet.UtxoEntry;

import java.util.List;

public interface UtxoRepository {

	public void init() throws DataException;

	/** Records a received output, or the spend of one, depending on the entry's direction. */
	public void add(UtxoEntry utxoEntry) throws DataException;

	/** Releases outputs reserved under <tt>lockId</tt>. */
	public void unlock(String lockId) throws DataException;

	/** Returns unspent outputs covering <tt>amount</tt>, chosen by <tt>strategy</tt>. */
	public List<UtxoEntry> getUtxoForAmount(Coin amount, String strategy) throws DataException;

	/** Reconciles recorded outputs against recorded spends. */
	public void process() throws DataException;

	public void close() throws DataException;

}
