package org.chainsync.utils;

public enum AmountUnit {
	/** Whole coins, e.g. "0.5" BTC */
	MAIN,
	/** Smallest unit, e.g. "50000000" satoshi */
	BASE
}
