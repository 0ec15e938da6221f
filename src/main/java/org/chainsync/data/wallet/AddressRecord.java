package org.chainsync.data.wallet;

import org.chainsync.wallet.Direction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Ledger for one address, with the outpoints already folded into it.
 */
public class AddressRecord {

	private final String address;
	private final LedgerBalance ledger;
	private final Set<String> outputPoints;
	private final Set<String> inputPoints;

	public AddressRecord(String address) {
		this(address, new LedgerBalance(), new LinkedHashSet<>(), new LinkedHashSet<>());
	}

	public AddressRecord(String address, LedgerBalance ledger, Set<String> outputPoints, Set<String> inputPoints) {
		this.address = address;
		this.ledger = ledger;
		this.outputPoints = outputPoints;
		this.inputPoints = inputPoints;
	}

	/** Deep copy. */
	public AddressRecord(AddressRecord other) {
		this(other.address, new LedgerBalance(other.ledger),
				new LinkedHashSet<>(other.outputPoints), new LinkedHashSet<>(other.inputPoints));
	}

	public String getAddress() {
		return this.address;
	}

	public LedgerBalance getLedger() {
		return this.ledger;
	}

	public Set<String> getPoints(Direction direction) {
		return Collections.unmodifiableSet(direction == Direction.OUTPUT ? this.outputPoints : this.inputPoints);
	}

	/** Returns false if <tt>point</tt> was already recorded for <tt>direction</tt>. */
	public boolean recordPoint(Direction direction, String point) {
		return (direction == Direction.OUTPUT ? this.outputPoints : this.inputPoints).add(point);
	}

	@Override
	public String toString() {
		return String.format("{address: %s, ledger: %s}", this.address, this.ledger);
	}
}
