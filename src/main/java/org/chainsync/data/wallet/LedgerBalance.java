package org.chainsync.data.wallet;

import org.chainsync.wallet.Direction;

import java.util.Objects;

/**
 * Received, spent and fee totals, each split by transaction state.
 * <p>
 * Spendable amount per state is received minus spent.
 */
public class LedgerBalance {

	private final Balance received;
	private final Balance spent;
	private final Balance fee;

	public LedgerBalance() {
		this(new Balance(), new Balance(), new Balance());
	}

	public LedgerBalance(Balance received, Balance spent, Balance fee) {
		this.received = received;
		this.spent = spent;
		this.fee = fee;
	}

	/** Deep copy. */
	public LedgerBalance(LedgerBalance other) {
		this(new Balance(other.received), new Balance(other.spent), new Balance(other.fee));
	}

	public Balance get(Direction direction) {
		return direction == Direction.OUTPUT ? this.received : this.spent;
	}

	public Balance getReceived() {
		return this.received;
	}

	public Balance getSpent() {
		return this.spent;
	}

	public Balance getFee() {
		return this.fee;
	}

	public void add(LedgerBalance other) {
		this.received.add(other.received);
		this.spent.add(other.spent);
		this.fee.add(other.fee);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LedgerBalance that = (LedgerBalance) o;
		return received.equals(that.received) && spent.equals(that.spent) && fee.equals(that.fee);
	}

	@Override
	public int hashCode() {
		return Objects.hash(received, spent, fee);
	}

	@Override
	public String toString() {
		return String.format("{received: %s, spent: %s, fee: %s}", received, spent, fee);
	}
}
