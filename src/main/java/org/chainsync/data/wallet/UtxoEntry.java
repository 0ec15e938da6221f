package org.chainsync.data.wallet;

import org.bitcoinj.core.Coin;
import org.chainsync.wallet.Direction;
import org.chainsync.wallet.TxState;

/**
 * Output received by, or spent from, a wallet address.
 * <p>
 * For {@link Direction#INPUT} entries <tt>txid:index</tt> is the outpoint being spent and
 * <tt>spendingTxid</tt> the transaction spending it.
 */
public class UtxoEntry {

	private final String txid;
	private final int index;
	private final Coin value;
	private final String address;
	private final String path;
	private final String publicKey;
	private final int height;
	private final Direction direction;
	private final TxState txState;
	private final String spendingTxid;

	public UtxoEntry(String txid, int index, Coin value, String address, String path, String publicKey,
			int height, Direction direction, TxState txState, String spendingTxid) {
		this.txid = txid;
		this.index = index;
		this.value = value;
		this.address = address;
		this.path = path;
		this.publicKey = publicKey;
		this.height = height;
		this.direction = direction;
		this.txState = txState;
		this.spendingTxid = spendingTxid;
	}

	public String getTxid() {
		return this.txid;
	}

	public int getIndex() {
		return this.index;
	}

	public Coin getValue() {
		return this.value;
	}

	public String getAddress() {
		return this.address;
	}

	public String getPath() {
		return this.path;
	}

	public String getPublicKey() {
		return this.publicKey;
	}

	public int getHeight() {
		return this.height;
	}

	public Direction getDirection() {
		return this.direction;
	}

	public TxState getTxState() {
		return this.txState;
	}

	public String getSpendingTxid() {
		return this.spendingTxid;
	}

	public String getPoint() {
		return this.txid + ":" + this.index;
	}

	@Override
	public String toString() {
		return String.format("{%s %s %s, value: %s, state: %s}", this.direction, getPoint(), this.address, this.value.toPlainString(), this.txState);
	}
}
