package org.chainsync.data.wallet;

/**
 * Scan position for one account role.
 */
public class AccountSyncState {

	/** Last scanned path, or null to start at the first */
	private String path;
	/** Consecutive addresses without transactions */
	private int gap;
	/** Addresses with transactions found so far */
	private int gapEnd;

	public AccountSyncState() {
		this(null, 0, 0);
	}

	public AccountSyncState(String path, int gap, int gapEnd) {
		this.path = path;
		this.gap = gap;
		this.gapEnd = gapEnd;
	}

	public String getPath() {
		return this.path;
	}

	public int getGap() {
		return this.gap;
	}

	public int getGapEnd() {
		return this.gapEnd;
	}

	public void update(String path, int gap, int gapEnd) {
		this.path = path;
		this.gap = gap;
		this.gapEnd = gapEnd;
	}

	@Override
	public String toString() {
		return String.format("{path: %s, gap: %d, gapEnd: %d}", this.path, this.gap, this.gapEnd);
	}
}
