package org.chainsync.utils;

import org.bitcoinj.core.Coin;

import java.math.BigDecimal;

public abstract class Amounts {

	private Amounts() {
	}

	/**
	 * Converts a node-reported coin value (JSON number, e.g. <tt>0.1</tt>) to satoshis.
	 *
	 * @throws NumberFormatException if value is not numeric
	 * @throws ArithmeticException if value has more than 8 decimal places
	 */
	public static Coin fromNodeValue(Object value) {
		if (value == null)
			throw new NumberFormatException("missing amount");

		if (value instanceof Long || value instanceof Integer)
			return Coin.valueOf(((Number) value).longValue() * Coin.COIN.value);

		BigDecimal decimal = new BigDecimal(value.toString());
		return Coin.valueOf(decimal.movePointRight(Coin.SMALLEST_UNIT_EXPONENT).longValueExact());
	}

	public static Coin toCoin(String amount, AmountUnit unit) {
		switch (unit) {
			case MAIN:
				return Coin.parseCoin(amount);

			case BASE:
				return Coin.valueOf(Long.parseLong(amount));

			default:
				throw new IllegalArgumentException("unknown unit " + unit);
		}
	}

	public static Coin sum(Iterable<Coin> amounts) {
		Coin total = Coin.ZERO;
		for (Coin amount : amounts)
			total = total.add(amount);

		return total;
	}
}
