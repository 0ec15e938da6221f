package org.chainsync.crosschain;

import java.util.concurrent.CompletableFuture;

/**
 * RPC call dispatched to the node and not yet answered.
 */
public class PendingRequest {

	private final String id;
	private final String method;
	private final long sentTimeMillis;
	private final CompletableFuture<Object> future = new CompletableFuture<>();

	public PendingRequest(String id, String method) {
		this.id = id;
		this.method = method;
		this.sentTimeMillis = System.currentTimeMillis();
	}

	public String getId() {
		return id;
	}

	public String getMethod() {
		return method;
	}

	public long getSentTimeMillis() {
		return sentTimeMillis;
	}

	public CompletableFuture<Object> getFuture() {
		return future;
	}

	/** @param result may be null, which is a valid RPC result */
	public boolean resolve(Object result) {
		return this.future.complete(result);
	}

	public boolean reject(ChainDataException e) {
		return this.future.completeExceptionally(e);
	}
}
