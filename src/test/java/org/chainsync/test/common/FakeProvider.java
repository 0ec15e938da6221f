package org.chainsync.test.common;

import org.chainsync.crosschain.AddressBalance;
import org.chainsync.crosschain.ChainDataException;
import org.chainsync.crosschain.ChainDataProvider;
import org.chainsync.crosschain.DecoratedTransaction;
import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Provider serving canned address histories and transactions.
 */
public class FakeProvider extends ChainDataProvider {

	private final Map<String, List<DecoratedTransaction>> histories = new ConcurrentHashMap<>();
	private final Map<String, DecoratedTransaction> transactions = new ConcurrentHashMap<>();
	private final Set<String> refusedAddresses = ConcurrentHashMap.newKeySet();

	public final List<String> historyRequests = new CopyOnWriteArrayList<>();
	public final List<String> subscribed = new CopyOnWriteArrayList<>();
	public final List<String> unsubscribed = new CopyOnWriteArrayList<>();

	/** Called with each address whose history is requested, before answering. */
	public volatile Consumer<String> onHistoryRequest = address -> { };

	private volatile boolean connected = false;
	private volatile int height = FakeNode.BLOCK_COUNT;

	public FakeProvider() {
		super("Fake Provider");
	}

	public void addHistory(String address, DecoratedTransaction... history) {
		List<DecoratedTransaction> list = this.histories.computeIfAbsent(address, k -> new CopyOnWriteArrayList<>());
		for (DecoratedTransaction transaction : history) {
			list.add(transaction);
			this.transactions.put(transaction.txid, transaction);
		}
	}

	public void addTransaction(DecoratedTransaction transaction) {
		this.transactions.put(transaction.txid, transaction);
	}

	public void refuseSubscription(String address) {
		this.refusedAddresses.add(address);
	}

	@Override
	public void connect(boolean reconnect) {
		this.connected = true;
	}

	@Override
	public boolean isConnected() {
		return this.connected;
	}

	@Override
	public int getCurrentHeight() {
		return this.height;
	}

	@Override
	public Object rpc(String method, Object... params) throws ChainDataException {
		throw new ChainDataException.ProtocolException("fake provider has no raw RPC: " + method);
	}

	@Override
	public CompletableFuture<Object> rpcAsync(String method, Object... params) {
		CompletableFuture<Object> future = new CompletableFuture<>();
		future.completeExceptionally(new ChainDataException.ProtocolException("fake provider has no raw RPC: " + method));
		return future;
	}

	@Override
	public String ping() {
		return "pong";
	}

	@Override
	@SuppressWarnings("unchecked")
	public DecoratedTransaction getTransaction(String txid, boolean useCache) throws ChainDataException {
		DecoratedTransaction transaction = this.transactions.get(txid);
		if (transaction == null) {
			JSONObject error = new JSONObject();
			error.put("code", -5L);
			error.put("message", "Invalid or non-wallet transaction id");
			throw new ChainDataException.RemoteException(error, "gettransaction");
		}

		return transaction;
	}

	@Override
	public List<DecoratedTransaction> getAddressHistory(String address, boolean useCache) {
		this.historyRequests.add(address);
		this.onHistoryRequest.accept(address);
		return new ArrayList<>(this.histories.getOrDefault(address, Collections.emptyList()));
	}

	@Override
	public AddressBalance getBalance(String address) {
		throw new UnsupportedOperationException();
	}

	@Override
	public String broadcastTransaction(String rawTransactionHex) {
		throw new UnsupportedOperationException();
	}

	@Override
	public void subscribeToBlocks() {
	}

	@Override
	public boolean unsubscribeFromBlocks() {
		return true;
	}

	@Override
	@SuppressWarnings("unchecked")
	public String subscribeToAddress(String address) throws ChainDataException {
		if (this.refusedAddresses.contains(address)) {
			JSONObject error = new JSONObject();
			error.put("code", -32603L);
			error.put("message", "subscription refused");
			throw new ChainDataException.RemoteException(error, "subscribe");
		}

		this.subscribed.add(address);
		return address;
	}

	@Override
	public boolean unsubscribeFromAddress(String address) {
		this.unsubscribed.add(address);
		return true;
	}

	@Override
	public void close() {
		this.connected = false;
	}
}
