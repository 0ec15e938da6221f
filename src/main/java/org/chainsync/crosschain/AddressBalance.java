package org.chainsync.crosschain;

import org.bitcoinj.core.Coin;

/** Amount received by an address, as reported by the node. */
public class AddressBalance {

	private final Coin confirmed;
	private final Coin unconfirmed;

	public AddressBalance(Coin confirmed, Coin unconfirmed) {
		this.confirmed = confirmed;
		this.unconfirmed = unconfirmed;
	}

	public Coin getConfirmed() {
		return confirmed;
	}

	/** Received with zero confirmations only. */
	public Coin getUnconfirmed() {
		return unconfirmed;
	}

	@Override
	public String toString() {
		return String.format("{confirmed: %s, unconfirmed: %s}", confirmed.toPlainString(), unconfirmed.toPlainString());
	}
}
