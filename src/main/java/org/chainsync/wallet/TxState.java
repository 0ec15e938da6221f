package org.chainsync.wallet;

public enum TxState {
	/** Not yet in a block */
	MEMPOOL,
	/** In a block, short of the confirmation threshold */
	PENDING,
	CONFIRMED;
}
