package org.chainsync.event;

import org.json.simple.JSONObject;

import java.util.Set;

/**
 * A transaction seen on the node's raw-transaction feed that pays at least one watched address.
 */
public class NewTransactionEvent implements Event {

	private final String txid;
	private final JSONObject decoded;
	private final Set<String> watchedAddresses;

	public NewTransactionEvent(String txid, JSONObject decoded, Set<String> watchedAddresses) {
		this.txid = txid;
		this.decoded = decoded;
		this.watchedAddresses = watchedAddresses;
	}

	public String getTxid() {
		return txid;
	}

	/** Transaction as returned by <tt>decoderawtransaction</tt>. */
	public JSONObject getDecoded() {
		return decoded;
	}

	/** Subscription handles (watched addresses) touched by this transaction's outputs. */
	public Set<String> getWatchedAddresses() {
		return watchedAddresses;
	}
}
