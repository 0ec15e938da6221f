package org.chainsync.test.utils;

import org.bitcoinj.core.Coin;
import org.chainsync.utils.AmountUnit;
import org.chainsync.utils.Amounts;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class AmountsTests {

	@Test
	public void testFromNodeValue() {
		Assert.assertEquals(Coin.valueOf(10_000_000L), Amounts.fromNodeValue(0.1d));
		Assert.assertEquals(Coin.valueOf(2_00000000L), Amounts.fromNodeValue(2L));
		Assert.assertEquals(Coin.valueOf(1L), Amounts.fromNodeValue(0.00000001d));
		Assert.assertEquals(Coin.valueOf(1000L), Amounts.fromNodeValue(1.0E-5d));
	}

	@Test(expected = ArithmeticException.class)
	public void testTooPreciseNodeValue() {
		Amounts.fromNodeValue("0.000000001");
	}

	@Test(expected = NumberFormatException.class)
	public void testMissingNodeValue() {
		Amounts.fromNodeValue(null);
	}

	@Test
	public void testToCoin() {
		Assert.assertEquals(Coin.valueOf(150_000_000L), Amounts.toCoin("1.5", AmountUnit.MAIN));
		Assert.assertEquals(Coin.valueOf(1500L), Amounts.toCoin("1500", AmountUnit.BASE));
	}

	@Test
	public void testSum() {
		Assert.assertEquals(Coin.valueOf(6L), Amounts.sum(Arrays.asList(Coin.valueOf(1L), Coin.valueOf(2L), Coin.valueOf(3L))));
		Assert.assertEquals(Coin.ZERO, Amounts.sum(Arrays.asList()));
	}
}
