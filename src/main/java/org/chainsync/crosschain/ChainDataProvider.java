package org.chainsync.crosschain;

import org.chainsync.event.EventBus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public abstract class ChainDataProvider {

	public static final boolean USE_CACHE = true;
	public static final boolean BYPASS_CACHE = false;

	protected final EventBus eventBus;

	protected ChainDataProvider(String name) {
		this.eventBus = new EventBus(name);
	}

	/** Returns bus carrying block, transaction, subscription and client-error events. */
	public EventBus getEventBus() {
		return this.eventBus;
	}

	/** Opens request socket, resetting reconnect attempt counter if <tt>reconnect</tt> is set. */
	public abstract void connect(boolean reconnect) throws ChainDataException;

	public void connect() throws ChainDataException {
		connect(false);
	}

	public abstract boolean isConnected();

	/** Returns most recently observed chain height. */
	public abstract int getCurrentHeight();

	/** Sends <tt>method</tt> and blocks until its result (possibly null) arrives. */
	public abstract Object rpc(String method, Object... params) throws ChainDataException;

	/** Sends <tt>method</tt>, returning future completed with result or {@link ChainDataException}. */
	public abstract CompletableFuture<Object> rpcAsync(String method, Object... params);

	/** Returns liveness reply from node. */
	public abstract String ping() throws ChainDataException;

	/** Returns transaction with resolved inputs and fee. */
	public abstract DecoratedTransaction getTransaction(String txid, boolean useCache) throws ChainDataException;

	public DecoratedTransaction getTransaction(String txid) throws ChainDataException {
		return getTransaction(txid, USE_CACHE);
	}

	/** Returns every transaction paying to <tt>address</tt>, including mempool. */
	public abstract List<DecoratedTransaction> getAddressHistory(String address, boolean useCache) throws ChainDataException;

	public List<DecoratedTransaction> getAddressHistory(String address) throws ChainDataException {
		return getAddressHistory(address, USE_CACHE);
	}

	public abstract AddressBalance getBalance(String address) throws ChainDataException;

	/** Broadcasts raw transaction hex, returning txid. */
	public abstract String broadcastTransaction(String rawTransactionHex) throws ChainDataException;

	public abstract void subscribeToBlocks() throws ChainDataException;

	public abstract boolean unsubscribeFromBlocks();

	/** Watches <tt>address</tt> for new transactions, returning subscription handle. */
	public abstract String subscribeToAddress(String address) throws ChainDataException;

	public abstract boolean unsubscribeFromAddress(String address);

	/** Terminal: fails pending requests, stops reconnecting and releases both sockets. */
	public abstract void close();

}
