package org.chainsync.crosschain;

import com.google.common.io.BaseEncoding;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.Coin;
import org.chainsync.event.ClientErrorEvent;
import org.chainsync.event.Event;
import org.chainsync.event.NewBlockEvent;
import org.chainsync.event.NewTransactionEvent;
import org.chainsync.event.SubscriptionNotificationEvent;
import org.chainsync.settings.Settings;
import org.chainsync.utils.Amounts;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.ParseException;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Bitcoin Core JSON-RPC client.
 * <p>
 * Requests are pipelined over one persistent socket and correlated with responses by id.
 * Block and transaction notifications come from the node's ZMQ publisher, opened lazily
 * on the first subscription and closed again when no topic needs it.
 */
public class BitcoinCore extends ChainDataProvider {

	private static final Logger LOGGER = LogManager.getLogger(BitcoinCore.class);

	private static final String SUBSCRIPTION_MARKER = ".subscribe";
	private static final String COINBASE_PREV_TXID_SUFFIX = "00000000";
	private static final int CONNECTION_HISTORY_LIMIT = 50;

	/** HTTP status line or header, echoed around JSON bodies by the node. */
	private static final Pattern HTTP_ENVELOPE_LINE = Pattern.compile("^(HTTP/\\d(\\.\\d)? \\d{3}.*|[A-Za-z][A-Za-z0-9-]*: .*)$");

	private final String host;
	private final int port;
	private final String authorization;
	private final String requestPath;
	private final int connectTimeout;
	private final long reconnectInterval;
	private final int maxReconnectAttempts;
	private final String eventEndpoint;
	private final int eventPollInterval;

	private final ResponseCache<TransactionRecord> cache;
	private final ConnectionAttemptRecorder connectionAttempts = new ConnectionAttemptRecorder(CONNECTION_HISTORY_LIMIT);

	private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
	private final AtomicInteger reconnectCount = new AtomicInteger();
	private final ScheduledExecutorService reconnectScheduler;
	private final ExecutorService notificationExecutor;

	private final Object connectionLock = new Object();
	private volatile ConnectionState state = ConnectionState.DISCONNECTED;
	private NodeConnection connection;
	private CompletableFuture<Void> connectFuture;

	private volatile int blockHeight = 0;

	private final Object subscriptionLock = new Object();
	private final Map<NotificationTopic, Consumer<String>> topicHandlers = new ConcurrentHashMap<>();
	private final Set<String> watchedAddresses = Collections.synchronizedSet(new LinkedHashSet<>());
	private EventSocket eventSocket;

	public BitcoinCore() {
		this(Settings.getInstance());
	}

	public BitcoinCore(Settings settings) {
		super("Bitcoin Core");

		this.host = settings.getNodeHost();
		this.port = settings.getNodePort();
		this.authorization = BaseEncoding.base64().encode(
				(settings.getRpcUser() + ":" + settings.getRpcPassword()).getBytes(StandardCharsets.UTF_8));
		String walletName = settings.getWalletName();
		this.requestPath = walletName == null || walletName.isEmpty() ? "/" : "/wallet/" + walletName;
		this.connectTimeout = settings.getConnectTimeout();
		this.reconnectInterval = settings.getReconnectInterval();
		this.maxReconnectAttempts = settings.getMaxReconnectAttempts();
		this.eventEndpoint = settings.getZmqEndpoint();
		this.eventPollInterval = settings.getEventSocketPollInterval();

		this.cache = new ResponseCache<>(settings.getCacheTimeout(), settings.getMaxCacheSize(), settings.getCacheSweepInterval());

		this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(
				new ThreadFactoryBuilder().setNameFormat("Bitcoin Core Reconnect-%d").setDaemon(true).build());
		this.notificationExecutor = Executors.newSingleThreadExecutor(
				new ThreadFactoryBuilder().setNameFormat("Bitcoin Core Notifications-%d").setDaemon(true).build());
	}

	// Connection

	@Override
	public void connect(boolean reconnect) throws ChainDataException {
		if (this.state == ConnectionState.CLOSED)
			throw new ChainDataException.ClosedException();

		if (reconnect)
			this.reconnectCount.set(0);

		CompletableFuture<Void> future;
		boolean inFlight;
		synchronized (this.connectionLock) {
			if (this.state == ConnectionState.CONNECTED)
				return;

			// Join a connect or scheduled reconnect rather than dialling again
			inFlight = this.connectFuture != null && !this.connectFuture.isDone();
			if (!inFlight)
				this.connectFuture = new CompletableFuture<>();

			future = this.connectFuture;
		}

		if (!inFlight)
			openConnection(future);

		try {
			future.get();
		} catch (ExecutionException e) {
			throw unwrap(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ChainDataException.NotConnectedException("interrupted while connecting");
		}
	}

	private void openConnection(CompletableFuture<Void> future) {
		String endpoint = this.host + ":" + this.port;

		synchronized (this.connectionLock) {
			if (this.state == ConnectionState.CLOSED) {
				future.completeExceptionally(new ChainDataException.ClosedException());
				return;
			}

			this.state = ConnectionState.CONNECTING;
		}

		NodeConnection newConnection;
		try {
			newConnection = NodeConnection.open(new InetSocketAddress(this.host, this.port), this.connectTimeout, new NodeConnection.Handler() {
				@Override
				public void onLine(NodeConnection source, String line) {
					handleLine(line);
				}

				@Override
				public void onClose(NodeConnection source, IOException cause) {
					onConnectionClosed(source, cause);
				}
			});
		} catch (IOException e) {
			LOGGER.debug("Unable to connect to {}: {}", endpoint, e.getMessage());
			this.connectionAttempts.recordAttempt(endpoint, this.reconnectCount.get(), false, e.getMessage());

			synchronized (this.connectionLock) {
				if (this.state != ConnectionState.CLOSED)
					this.state = ConnectionState.DISCONNECTED;
			}

			scheduleReconnect(future, e);
			return;
		}

		NodeConnection previousConnection;
		synchronized (this.connectionLock) {
			if (this.state == ConnectionState.CLOSED) {
				newConnection.close();
				future.completeExceptionally(new ChainDataException.ClosedException());
				return;
			}

			previousConnection = this.connection;
			this.connection = newConnection;
			this.state = ConnectionState.CONNECTED;
		}

		if (previousConnection != null)
			previousConnection.close();

		try {
			newConnection.startReading();
		} catch (IOException e) {
			newConnection.close();
			onConnectionClosed(newConnection, e);
			return;
		}

		this.connectionAttempts.recordAttempt(endpoint, this.reconnectCount.getAndSet(0), true, "");
		LOGGER.info("Connected to Bitcoin Core at {}", endpoint);

		// connect() returns once height is known, so derived transaction heights are usable
		refreshBlockHeight().whenComplete((ignored, e) -> future.complete(null));
	}

	private void onConnectionClosed(NodeConnection source, IOException cause) {
		CompletableFuture<Void> future;

		synchronized (this.connectionLock) {
			if (this.connection != source)
				return;

			this.connection = null;

			if (this.state == ConnectionState.CLOSED)
				return;

			this.state = ConnectionState.DISCONNECTED;

			future = new CompletableFuture<>();
			this.connectFuture = future;
		}

		String reason = cause != null ? cause.getMessage() : "connection closed by node";
		LOGGER.info("Lost connection to Bitcoin Core at {}:{}: {}", this.host, this.port, reason);

		failPendingRequests(new ChainDataException.NotConnectedException("connection to node lost: " + reason));

		scheduleReconnect(future, cause);
	}

	private void scheduleReconnect(CompletableFuture<Void> future, Throwable cause) {
		String reason = cause != null ? cause.getMessage() : "connection closed";

		if (this.state == ConnectionState.CLOSED) {
			future.completeExceptionally(new ChainDataException.ClosedException());
			return;
		}

		if (this.reconnectCount.get() >= this.maxReconnectAttempts) {
			giveUp(future, reason, cause);
			return;
		}

		try {
			this.reconnectScheduler.schedule(() -> {
				if (this.state == ConnectionState.CLOSED) {
					future.completeExceptionally(new ChainDataException.ClosedException());
					return;
				}

				int attempt = this.reconnectCount.incrementAndGet();
				LOGGER.debug("Reconnecting to Bitcoin Core at {}:{}, attempt {} of {}", this.host, this.port, attempt, this.maxReconnectAttempts);

				openConnection(future);
			}, this.reconnectInterval, TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException e) {
			future.completeExceptionally(new ChainDataException.ClosedException());
		}
	}

	private void giveUp(CompletableFuture<Void> future, String reason, Throwable cause) {
		ChainDataException.ReconnectException e = new ChainDataException.ReconnectException("gave up connecting to Bitcoin Core " + reason, cause);

		if (!future.completeExceptionally(e))
			return;

		LOGGER.error(e.getMessage());
	}

	private void failPendingRequests(ChainDataException e) {
		for (String id : new ArrayList<>(this.pendingRequests.keySet())) {
			PendingRequest request = this.pendingRequests.remove(id);
			if (request != null)
				request.reject(e);
		}
	}

	private CompletableFuture<Void> refreshBlockHeight() {
		return rpcAsync("getblockcount").handle((result, e) -> {
			if (e != null)
				LOGGER.warn("Unable to refresh block height: {}", e.getMessage());
			else if (result instanceof Number)
				updateBlockHeight(((Number) result).intValue());

			return null;
		});
	}

	private void updateBlockHeight(int height) {
		if (height > this.blockHeight) {
			this.blockHeight = height;
			LOGGER.debug("Node block height now {}", height);
		}
	}

	@Override
	public boolean isConnected() {
		return this.state == ConnectionState.CONNECTED;
	}

	public ConnectionState getState() {
		return this.state;
	}

	@Override
	public int getCurrentHeight() {
		return this.blockHeight;
	}

	public List<ConnectionAttempt> getConnectionAttempts() {
		return this.connectionAttempts.getAttempts();
	}

	public int getPendingRequestCount() {
		return this.pendingRequests.size();
	}

	public boolean isEventSocketOpen() {
		synchronized (this.subscriptionLock) {
			return this.eventSocket != null && this.eventSocket.isRunning();
		}
	}

	// Requests

	@Override
	public Object rpc(String method, Object... params) throws ChainDataException {
		try {
			return rpcAsync(method, params).get();
		} catch (ExecutionException e) {
			throw unwrap(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ChainDataException.NotConnectedException("interrupted while waiting for " + method);
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public CompletableFuture<Object> rpcAsync(String method, Object... params) {
		CompletableFuture<Object> failed = new CompletableFuture<>();

		NodeConnection currentConnection;
		synchronized (this.connectionLock) {
			if (this.state == ConnectionState.CLOSED) {
				failed.completeExceptionally(new ChainDataException.ClosedException());
				return failed;
			}

			currentConnection = this.connection;
			if (this.state != ConnectionState.CONNECTED || currentConnection == null) {
				failed.completeExceptionally(new ChainDataException.NotConnectedException());
				return failed;
			}
		}

		String id = newRequestId();

		JSONObject requestJson = new JSONObject();
		requestJson.put("jsonrpc", "1.0");
		requestJson.put("id", id);
		requestJson.put("method", method);

		JSONArray requestParams = new JSONArray();
		requestParams.addAll(Arrays.asList(params));
		requestJson.put("params", requestParams);

		String request = requestJson.toJSONString();
		LOGGER.trace(() -> String.format("Request: %s", request));

		PendingRequest pendingRequest = new PendingRequest(id, method);
		this.pendingRequests.put(id, pendingRequest);

		try {
			currentConnection.write(httpRequest(request).getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			this.pendingRequests.remove(id);
			pendingRequest.reject(new ChainDataException.NotConnectedException(String.format("unable to send %s: %s", method, e.getMessage())));
		}

		return pendingRequest.getFuture();
	}

	private String httpRequest(String body) {
		byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);

		return "POST " + this.requestPath + " HTTP/1.1\r\n" +
				"Host: " + this.host + "\r\n" +
				"Authorization: Basic " + this.authorization + "\r\n" +
				"Content-Type: application/json\r\n" +
				"Content-Length: " + bodyBytes.length + "\r\n" +
				"\r\n" +
				body;
	}

	private static String newRequestId() {
		return System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(100_000_000);
	}

	/** Dispatches one line received on the request socket. */
	void handleLine(String rawLine) {
		String line = rawLine.trim();
		if (line.isEmpty() || HTTP_ENVELOPE_LINE.matcher(line).matches())
			return;

		Object responseObj;
		try {
			responseObj = JSONValue.parseWithException(line);
		} catch (ParseException e) {
			LOGGER.debug("Unparseable response from node: {}", line);
			publish(new ClientErrorEvent(ClientErrorEvent.Reason.MALFORMED_RESPONSE, "unable to parse response: " + line));
			return;
		}

		if (!(responseObj instanceof JSONObject)) {
			publish(new ClientErrorEvent(ClientErrorEvent.Reason.MALFORMED_RESPONSE, "expected JSON object: " + line));
			return;
		}

		LOGGER.trace(() -> String.format("Response: %s", line));

		JSONObject responseJson = (JSONObject) responseObj;
		Object idObj = responseJson.get("id");
		String id = idObj != null ? idObj.toString() : null;

		Object methodObj = responseJson.get("method");
		if (methodObj instanceof String && ((String) methodObj).endsWith(SUBSCRIPTION_MARKER)) {
			handleSubscriptionNotification(id, (String) methodObj, responseJson);
			return;
		}

		PendingRequest request = id != null ? this.pendingRequests.remove(id) : null;
		if (request == null) {
			LOGGER.debug("No pending request for response id {}", id);
			publish(new ClientErrorEvent(ClientErrorEvent.Reason.UNMATCHED_RESPONSE, "no handler for response id " + id + ": " + line));
			return;
		}

		Object errorObj = responseJson.get("error");
		if (errorObj != null) {
			ChainDataException.RemoteException e = new ChainDataException.RemoteException(errorObj, request.getMethod());
			LOGGER.debug(e.getMessage());
			request.reject(e);
			return;
		}

		request.resolve(responseJson.get("result"));
	}

	private void handleSubscriptionNotification(String id, String method, JSONObject notificationJson) {
		Object value = null;
		Object paramsObj = notificationJson.get("params");
		if (paramsObj instanceof JSONArray && !((JSONArray) paramsObj).isEmpty()) {
			JSONArray params = (JSONArray) paramsObj;
			value = params.get(params.size() - 1);
		}

		publish(new SubscriptionNotificationEvent(method, value));

		if (id == null)
			return;

		PendingRequest request = this.pendingRequests.remove(id);
		if (request != null)
			request.reject(new ChainDataException.ProtocolException(
					String.format("response to %s was consumed as %s notification", request.getMethod(), method)));
	}

	private void publish(Event event) {
		try {
			this.notificationExecutor.execute(() -> this.eventBus.notify(event));
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Dropped {} after close", event.getClass().getSimpleName());
		}
	}

	private static ChainDataException unwrap(ExecutionException e) {
		Throwable cause = e.getCause();
		if (cause instanceof ChainDataException)
			return (ChainDataException) cause;

		return new ChainDataException(cause != null ? cause.getMessage() : e.getMessage(), cause);
	}

	// Wallet/chain queries

	@Override
	public String ping() throws ChainDataException {
		Object result = rpc("ping");
		if (result != null)
			throw new ChainDataException.ProtocolException("unexpected ping result: " + result);

		return "pong";
	}

	@Override
	public DecoratedTransaction getTransaction(String txid, boolean useCache) throws ChainDataException {
		TransactionRecord transaction = fetchTransaction(txid, useCache);

		try {
			JSONObject decoded = (JSONObject) transaction.getJson().get("decoded");
			if (decoded == null)
				throw new ChainDataException.ProtocolException("missing decoded transaction for " + txid);

			List<DecoratedTransaction.Output> outputs = new ArrayList<>();
			List<Boolean> standardOutputs = new ArrayList<>();
			Coin totalOut = Coin.ZERO;

			for (Object outputObj : (JSONArray) decoded.get("vout")) {
				DecoratedTransaction.Output output = parseOutput((JSONObject) outputObj, txid, transaction.getHeight());

				outputs.add(output);
				standardOutputs.add(output.isStandard());

				if (output.isStandard())
					totalOut = totalOut.add(output.value);
			}

			List<DecoratedTransaction.Input> inputs = new ArrayList<>();
			List<Boolean> standardInputs = new ArrayList<>();
			List<String> unconfirmedInputs = new ArrayList<>();
			Coin totalIn = Coin.ZERO;

			for (Object inputObj : (JSONArray) decoded.get("vin")) {
				JSONObject inputJson = (JSONObject) inputObj;

				Object coinbase = inputJson.get("coinbase");
				if (coinbase != null) {
					// Block reward, not counted towards fee
					int prevHeight = transaction.getHeight() - 1;
					inputs.add(new DecoratedTransaction.Input((String) coinbase, BlockSubsidy.getBlockReward(prevHeight), null,
							txid, transaction.getHeight(), coinbase + COINBASE_PREV_TXID_SUFFIX, 0, prevHeight, true));
					standardInputs.add(false);
					continue;
				}

				String prevTxid = (String) inputJson.get("txid");
				int prevIndex = ((Number) inputJson.get("vout")).intValue();

				TransactionRecord prevTransaction = fetchTransaction(prevTxid, useCache);
				JSONObject prevDecoded = (JSONObject) prevTransaction.getJson().get("decoded");
				JSONArray prevOutputs = (JSONArray) prevDecoded.get("vout");
				if (prevIndex < 0 || prevIndex >= prevOutputs.size())
					throw new ChainDataException.ProtocolException(String.format("output %d missing from %s", prevIndex, prevTxid));

				DecoratedTransaction.Output spent = parseOutput((JSONObject) prevOutputs.get(prevIndex), txid, transaction.getHeight());

				inputs.add(new DecoratedTransaction.Input(spent.address, spent.value, spent.scriptHex,
						txid, transaction.getHeight(), prevTxid, prevIndex, prevTransaction.getHeight(), false));
				standardInputs.add(spent.isStandard());

				if (!prevTransaction.isConfirmed())
					unconfirmedInputs.add(prevTxid);

				totalIn = totalIn.add(spent.value);
			}

			Coin fee = totalIn.isZero() ? Coin.ZERO : totalIn.subtract(totalOut);

			return new DecoratedTransaction(txid, transaction.getHeight(), outputs, inputs,
					standardOutputs, standardInputs, unconfirmedInputs, fee);
		} catch (NullPointerException | ClassCastException | NumberFormatException | ArithmeticException e) {
			// Response didn't match what we expected
			throw new ChainDataException.ProtocolException(String.format("unexpected gettransaction response for %s: %s", txid, e));
		}
	}

	private static DecoratedTransaction.Output parseOutput(JSONObject outputJson, String txid, int height) {
		JSONObject scriptPubKey = (JSONObject) outputJson.get("scriptPubKey");

		String address = (String) scriptPubKey.get("address");
		if (address == null) {
			// Older nodes report a list of addresses
			Object addressesObj = scriptPubKey.get("addresses");
			if (addressesObj instanceof JSONArray && ((JSONArray) addressesObj).size() == 1)
				address = (String) ((JSONArray) addressesObj).get(0);
		}

		Coin value = Amounts.fromNodeValue(outputJson.get("value"));
		int index = ((Number) outputJson.get("n")).intValue();

		return new DecoratedTransaction.Output(address, value, (String) scriptPubKey.get("hex"), index, txid, height);
	}

	/**
	 * Returns wallet transaction, from cache if allowed.
	 * <p>
	 * Only confirmed transactions are served from cache; unconfirmed ones are refetched
	 * so their height catches up once mined.
	 */
	private TransactionRecord fetchTransaction(String txid, boolean useCache) throws ChainDataException {
		if (useCache) {
			Optional<TransactionRecord> cached = this.cache.get(txid);
			if (cached.isPresent() && cached.get().isConfirmed())
				return cached.get();
		}

		Object transactionObj = rpc("gettransaction", txid, true, true);
		if (!(transactionObj instanceof JSONObject))
			throw new ChainDataException.ProtocolException("expected JSONObject from gettransaction for " + txid);

		JSONObject transactionJson = (JSONObject) transactionObj;
		if (isConfirmed(transactionJson))
			updateBlockHeight(fetchBlockCount());

		TransactionRecord transaction = new TransactionRecord(txid, transactionJson, heightOf(transactionJson));

		this.cache.set(txid, transaction);

		return transaction;
	}

	private int fetchBlockCount() throws ChainDataException {
		Object countObj = rpc("getblockcount");
		if (!(countObj instanceof Number))
			throw new ChainDataException.ProtocolException("expected number from getblockcount");

		return ((Number) countObj).intValue();
	}

	private static long confirmationsOf(JSONObject transactionJson) {
		Object confirmationsObj = transactionJson.get("confirmations");
		return confirmationsObj instanceof Number ? ((Number) confirmationsObj).longValue() : 0L;
	}

	private static boolean isConfirmed(JSONObject transactionJson) {
		return confirmationsOf(transactionJson) > 0;
	}

	private int heightOf(JSONObject transactionJson) {
		if (!isConfirmed(transactionJson))
			return TransactionRecord.UNCONFIRMED_HEIGHT;

		return (int) (this.blockHeight - (confirmationsOf(transactionJson) - 1));
	}

	@Override
	public List<DecoratedTransaction> getAddressHistory(String address, boolean useCache) throws ChainDataException {
		Object receivedObj = rpc("listreceivedbyaddress", 0, false, true, address);
		if (!(receivedObj instanceof JSONArray))
			throw new ChainDataException.ProtocolException("expected JSONArray from listreceivedbyaddress");

		JSONArray received = (JSONArray) receivedObj;
		if (received.isEmpty())
			return Collections.emptyList();

		Object txidsObj = ((JSONObject) received.get(0)).get("txids");
		if (!(txidsObj instanceof JSONArray))
			throw new ChainDataException.ProtocolException("expected txids from listreceivedbyaddress for " + address);

		List<DecoratedTransaction> history = new ArrayList<>();
		for (Object txid : (JSONArray) txidsObj)
			history.add(getTransaction((String) txid, useCache));

		return history;
	}

	@Override
	public AddressBalance getBalance(String address) throws ChainDataException {
		try {
			Coin confirmed = Amounts.fromNodeValue(rpc("getreceivedbyaddress", address, 1));
			Coin total = Amounts.fromNodeValue(rpc("getreceivedbyaddress", address, 0));

			return new AddressBalance(confirmed, total.subtract(confirmed));
		} catch (NumberFormatException | ArithmeticException e) {
			throw new ChainDataException.ProtocolException("unexpected getreceivedbyaddress response for " + address);
		}
	}

	@Override
	public String broadcastTransaction(String rawTransactionHex) throws ChainDataException {
		Object txid = rpc("sendrawtransaction", rawTransactionHex);
		if (!(txid instanceof String))
			throw new ChainDataException.ProtocolException("expected txid from sendrawtransaction");

		return (String) txid;
	}

	// Subscriptions

	@Override
	public void subscribeToBlocks() throws ChainDataException {
		synchronized (this.subscriptionLock) {
			EventSocket socket = openEventSocket();

			this.topicHandlers.put(NotificationTopic.HASHBLOCK, this::onBlockHash);
			socket.subscribe(NotificationTopic.HASHBLOCK);
		}
	}

	@Override
	public boolean unsubscribeFromBlocks() {
		synchronized (this.subscriptionLock) {
			if (this.topicHandlers.remove(NotificationTopic.HASHBLOCK) != null && this.eventSocket != null)
				this.eventSocket.unsubscribe(NotificationTopic.HASHBLOCK);

			closeEventSocketIfUnused();
		}

		return true;
	}

	@Override
	public String subscribeToAddress(String address) throws ChainDataException {
		synchronized (this.subscriptionLock) {
			EventSocket socket = openEventSocket();

			this.watchedAddresses.add(address);

			// Later addresses share the raw transaction feed
			if (!this.topicHandlers.containsKey(NotificationTopic.RAWTX)) {
				this.topicHandlers.put(NotificationTopic.RAWTX, this::onRawTransaction);
				socket.subscribe(NotificationTopic.RAWTX);
			}
		}

		return address;
	}

	@Override
	public boolean unsubscribeFromAddress(String address) {
		synchronized (this.subscriptionLock) {
			this.watchedAddresses.remove(address);

			if (this.watchedAddresses.isEmpty() && this.topicHandlers.remove(NotificationTopic.RAWTX) != null && this.eventSocket != null)
				this.eventSocket.unsubscribe(NotificationTopic.RAWTX);

			closeEventSocketIfUnused();
		}

		return true;
	}

	public Set<String> getWatchedAddresses() {
		synchronized (this.watchedAddresses) {
			return new LinkedHashSet<>(this.watchedAddresses);
		}
	}

	// Call while holding subscriptionLock
	private EventSocket openEventSocket() throws ChainDataException {
		if (this.state == ConnectionState.CLOSED)
			throw new ChainDataException.ClosedException();

		if (this.eventSocket == null || !this.eventSocket.isRunning()) {
			this.eventSocket = new EventSocket(this.eventEndpoint, this.eventPollInterval, this::onNotification);
			this.eventSocket.start();

			// Replay feeds onto replacement socket
			for (NotificationTopic topic : this.topicHandlers.keySet())
				this.eventSocket.subscribe(topic);
		}

		return this.eventSocket;
	}

	// Call while holding subscriptionLock
	private void closeEventSocketIfUnused() {
		if (!this.topicHandlers.isEmpty() || this.eventSocket == null)
			return;

		this.eventSocket.close();
		this.eventSocket = null;
	}

	private void onNotification(NotificationTopic topic, String payloadHex) {
		Consumer<String> handler = this.topicHandlers.get(topic);
		if (handler == null)
			return;

		try {
			this.notificationExecutor.execute(() -> handler.accept(payloadHex));
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Dropped {} notification after close", topic.topic);
		}
	}

	private void onBlockHash(String blockHash) {
		try {
			Object rawBlock = rpc("getblock", blockHash, 0);
			Object blockObj = rpc("getblock", blockHash, 1);
			if (!(rawBlock instanceof String) || !(blockObj instanceof JSONObject)) {
				LOGGER.warn("Unexpected getblock response for {}", blockHash);
				return;
			}

			int height = ((Number) ((JSONObject) blockObj).get("height")).intValue();
			updateBlockHeight(height);

			this.eventBus.notify(new NewBlockEvent(height, (String) rawBlock));
		} catch (ChainDataException | ClassCastException | NullPointerException e) {
			LOGGER.warn("Unable to process new block {}: {}", blockHash, e.getMessage());
		}
	}

	private void onRawTransaction(String rawTransactionHex) {
		try {
			Object decodedObj = rpc("decoderawtransaction", rawTransactionHex);
			if (!(decodedObj instanceof JSONObject)) {
				LOGGER.warn("Unexpected decoderawtransaction response");
				return;
			}

			JSONObject decoded = (JSONObject) decodedObj;

			Set<String> matched = new LinkedHashSet<>();
			for (Object outputObj : (JSONArray) decoded.get("vout")) {
				JSONObject scriptPubKey = (JSONObject) ((JSONObject) outputObj).get("scriptPubKey");
				Object address = scriptPubKey != null ? scriptPubKey.get("address") : null;

				if (address instanceof String && this.watchedAddresses.contains(address))
					matched.add((String) address);
			}

			if (matched.isEmpty())
				return;

			String txid = (String) decoded.get("txid");
			LOGGER.debug("Transaction {} pays to watched {}", txid, matched);

			this.eventBus.notify(new NewTransactionEvent(txid, decoded, matched));
		} catch (ChainDataException | ClassCastException | NullPointerException e) {
			LOGGER.warn("Unable to process new transaction: {}", e.getMessage());
		}
	}

	// Shutdown

	@Override
	public void close() {
		NodeConnection currentConnection;
		CompletableFuture<Void> pendingConnect;

		synchronized (this.connectionLock) {
			if (this.state == ConnectionState.CLOSED)
				return;

			this.state = ConnectionState.CLOSED;
			currentConnection = this.connection;
			this.connection = null;
			pendingConnect = this.connectFuture;
		}

		this.reconnectCount.set(this.maxReconnectAttempts);
		this.reconnectScheduler.shutdownNow();

		synchronized (this.subscriptionLock) {
			this.topicHandlers.clear();
			this.watchedAddresses.clear();
			closeEventSocketIfUnused();
		}

		if (currentConnection != null)
			currentConnection.close();

		failPendingRequests(new ChainDataException.ClosedException());

		if (pendingConnect != null)
			pendingConnect.completeExceptionally(new ChainDataException.ClosedException());

		this.notificationExecutor.shutdownNow();
		this.cache.stop();
		this.eventBus.clearListeners();

		LOGGER.info("Closed Bitcoin Core client for {}:{}", this.host, this.port);
	}

}
