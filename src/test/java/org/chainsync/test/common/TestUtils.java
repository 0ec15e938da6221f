package org.chainsync.test.common;

import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.util.function.BooleanSupplier;

public class TestUtils {

	private TestUtils() {
	}

	/** Polls <tt>condition</tt> until true, failing after <tt>timeoutMillis</tt>. */
	public static void waitUntil(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMillis;

		while (!condition.getAsBoolean()) {
			if (System.currentTimeMillis() > deadline)
				throw new AssertionError("condition not met within " + timeoutMillis + "ms");

			Thread.sleep(20);
		}
	}

	/** Parses JSON written with single quotes, for readable fixtures. */
	public static JSONObject json(String singleQuoted) {
		return (JSONObject) JSONValue.parse(singleQuoted.replace('\'', '"'));
	}
}
