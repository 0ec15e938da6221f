package org.chainsync.wallet;

/**
 * HD chain within an account.
 */
public enum AccountRole {
	/** Receiving addresses */
	EXTERNAL(0),
	/** Change addresses */
	INTERNAL(1);

	public final int chain;

	AccountRole(int chain) {
		this.chain = chain;
	}
}
