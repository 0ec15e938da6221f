package org.chainsync.crosschain;

import org.bitcoinj.core.Coin;

/**
 * Block reward schedule: 50 coins, halving every 210,000 blocks.
 */
public abstract class BlockSubsidy {

	public static final Coin INITIAL_SUBSIDY = Coin.FIFTY_COINS;
	public static final int HALVING_INTERVAL = 210_000;

	private BlockSubsidy() {
	}

	public static Coin getBlockReward(int height) {
		// Coinbase of an unconfirmed transaction would sit at height -1
		int halvings = Math.max(height, 0) / HALVING_INTERVAL;
		if (halvings >= 64)
			return Coin.ZERO;

		return INITIAL_SUBSIDY.shiftRight(halvings);
	}
}
