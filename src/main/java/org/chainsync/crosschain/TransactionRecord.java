package org.chainsync.crosschain;

import org.json.simple.JSONObject;

/**
 * Node's <tt>gettransaction</tt> response plus the height derived from its confirmations.
 */
public class TransactionRecord {

	public static final int UNCONFIRMED_HEIGHT = 0;

	private final String txid;
	private final JSONObject json;
	private final int height;

	public TransactionRecord(String txid, JSONObject json, int height) {
		this.txid = txid;
		this.json = json;
		this.height = height;
	}

	public String getTxid() {
		return txid;
	}

	public JSONObject getJson() {
		return json;
	}

	public int getHeight() {
		return height;
	}

	public boolean isConfirmed() {
		return this.height != UNCONFIRMED_HEIGHT;
	}
}
