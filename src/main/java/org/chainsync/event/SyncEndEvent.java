package org.chainsync.event;

import org.chainsync.wallet.AccountRole;

public class SyncEndEvent implements Event {

	private final AccountRole role;
	private final boolean halted;

	public SyncEndEvent(AccountRole role, boolean halted) {
		this.role = role;
		this.halted = halted;
	}

	public AccountRole getRole() {
		return role;
	}

	/** True if the scan stopped because of {@code stopSync()} rather than the gap limit. */
	public boolean isHalted() {
		return halted;
	}
}
