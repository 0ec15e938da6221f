package org.chainsync.wallet;

/**
 * Side of a transaction an address appears on.
 */
public enum Direction {
	/** Output paying to the address, i.e. received */
	OUTPUT,
	/** Input spending from the address */
	INPUT;
}
