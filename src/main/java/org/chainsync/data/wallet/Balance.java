package org.chainsync.data.wallet;

import org.bitcoinj.core.Coin;
import org.chainsync.wallet.TxState;

import java.util.Objects;

/**
 * Amounts split by transaction state.
 */
public class Balance {

	private Coin confirmed;
	private Coin pending;
	private Coin mempool;

	public Balance() {
		this(Coin.ZERO, Coin.ZERO, Coin.ZERO);
	}

	public Balance(Coin confirmed, Coin pending, Coin mempool) {
		this.confirmed = confirmed;
		this.pending = pending;
		this.mempool = mempool;
	}

	public Balance(Balance other) {
		this(other.confirmed, other.pending, other.mempool);
	}

	public Coin getConfirmed() {
		return this.confirmed;
	}

	public Coin getPending() {
		return this.pending;
	}

	public Coin getMempool() {
		return this.mempool;
	}

	public Coin get(TxState txState) {
		switch (txState) {
			case CONFIRMED:
				return this.confirmed;
			case PENDING:
				return this.pending;
			case MEMPOOL:
				return this.mempool;
			default:
				throw new IllegalArgumentException("unknown state " + txState);
		}
	}

	public void add(TxState txState, Coin amount) {
		switch (txState) {
			case CONFIRMED:
				this.confirmed = this.confirmed.add(amount);
				break;
			case PENDING:
				this.pending = this.pending.add(amount);
				break;
			case MEMPOOL:
				this.mempool = this.mempool.add(amount);
				break;
			default:
				throw new IllegalArgumentException("unknown state " + txState);
		}
	}

	public void add(Balance other) {
		this.confirmed = this.confirmed.add(other.confirmed);
		this.pending = this.pending.add(other.pending);
		this.mempool = this.mempool.add(other.mempool);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Balance balance = (Balance) o;
		return confirmed.equals(balance.confirmed) && pending.equals(balance.pending) && mempool.equals(balance.mempool);
	}

	@Override
	public int hashCode() {
		return Objects.hash(confirmed, pending, mempool);
	}

	@Override
	public String toString() {
		return String.format("{confirmed: %s, pending: %s, mempool: %s}",
				confirmed.toPlainString(), pending.toPlainString(), mempool.toPlainString());
	}
}
