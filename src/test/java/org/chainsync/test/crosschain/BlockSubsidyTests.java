package org.chainsync.test.crosschain;

import org.bitcoinj.core.Coin;
import org.chainsync.crosschain.BlockSubsidy;
import org.junit.Assert;
import org.junit.Test;

public class BlockSubsidyTests {

	@Test
	public void testInitialSubsidy() {
		Assert.assertEquals(Coin.valueOf(50_00000000L), BlockSubsidy.getBlockReward(0));
		Assert.assertEquals(Coin.valueOf(50_00000000L), BlockSubsidy.getBlockReward(209_999));
	}

	@Test
	public void testHalvings() {
		Assert.assertEquals(Coin.valueOf(25_00000000L), BlockSubsidy.getBlockReward(210_000));
		Assert.assertEquals(Coin.valueOf(12_50000000L), BlockSubsidy.getBlockReward(420_000));
		Assert.assertEquals(Coin.valueOf(6_25000000L), BlockSubsidy.getBlockReward(630_000));
	}

	@Test
	public void testSubsidyRunsOut() {
		Assert.assertEquals(Coin.ZERO, BlockSubsidy.getBlockReward(64 * BlockSubsidy.HALVING_INTERVAL));
		Assert.assertEquals(Coin.ZERO, BlockSubsidy.getBlockReward(Integer.MAX_VALUE));
	}

	@Test
	public void testNegativeHeightTreatedAsGenesis() {
		Assert.assertEquals(BlockSubsidy.INITIAL_SUBSIDY, BlockSubsidy.getBlockReward(-1));
	}
}
