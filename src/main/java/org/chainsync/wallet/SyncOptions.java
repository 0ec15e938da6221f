package org.chainsync.wallet;

public class SyncOptions {

	public static final SyncOptions DEFAULT = new SyncOptions(false);

	private final boolean restart;

	public SyncOptions(boolean restart) {
		this.restart = restart;
	}

	/** Whether persisted scan position should be ignored. */
	public boolean isRestart() {
		return restart;
	}
}
