package org.chainsync.repository;

import org.chainsync.crosschain.DecoratedTransaction;
import org.chainsync.data.wallet.AddressRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Per-address ledger records and the raw transaction history behind them.
 */
public interface AddressRepository {

	public void init() throws DataException;

	public Optional<AddressRecord> get(String address) throws DataException;

	public void set(AddressRecord addressRecord) throws DataException;

	/** Creates and stores an empty record for <tt>address</tt>. */
	public AddressRecord newAddress(String address) throws DataException;

	public void storeTxHistory(List<DecoratedTransaction> history) throws DataException;

	/** Passes every stored transaction to <tt>consumer</tt>. */
	public void getTransactions(Consumer<DecoratedTransaction> consumer) throws DataException;

	public void close() throws DataException;

}
