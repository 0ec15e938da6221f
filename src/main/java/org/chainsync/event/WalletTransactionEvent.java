package org.chainsync.event;

/**
 * Emitted by the sync engine once a provider transaction notification has been folded into the ledger.
 */
public class WalletTransactionEvent implements Event {

	private final String txid;

	public WalletTransactionEvent(String txid) {
		this.txid = txid;
	}

	public String getTxid() {
		return txid;
	}
}
