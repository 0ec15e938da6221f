package org.chainsync.event;

import org.chainsync.wallet.AccountRole;

public class SyncedPathEvent implements Event {

	private final AccountRole role;
	private final String path;
	private final boolean hasTransactions;
	private final int gapCount;
	private final int gapLimit;
	private final int gapEnd;

	public SyncedPathEvent(AccountRole role, String path, boolean hasTransactions, int gapCount, int gapLimit, int gapEnd) {
		this.role = role;
		this.path = path;
		this.hasTransactions = hasTransactions;
		this.gapCount = gapCount;
		this.gapLimit = gapLimit;
		this.gapEnd = gapEnd;
	}

	public AccountRole getRole() {
		return role;
	}

	public String getPath() {
		return path;
	}

	public boolean hasTransactions() {
		return hasTransactions;
	}

	public int getGapCount() {
		return gapCount;
	}

	public int getGapLimit() {
		return gapLimit;
	}

	public int getGapEnd() {
		return gapEnd;
	}

	@Override
	public String toString() {
		return String.format("%s %s tx=%b gap=%d/%d end=%d", role, path, hasTransactions, gapCount, gapLimit, gapEnd);
	}
}
