package org.chainsync.test.settings;

import org.chainsync.settings.Settings;
import org.junit.Assert;
import org.junit.Test;

public class SettingsTests {

	@Test
	public void testDefaults() {
		Settings settings = Settings.fromJson("{}");

		Assert.assertEquals("127.0.0.1", settings.getNodeHost());
		Assert.assertEquals(18443, settings.getNodePort());
		Assert.assertNull(settings.getWalletName());
		Assert.assertEquals("tcp://127.0.0.1:28334", settings.getZmqEndpoint());
		Assert.assertEquals(20, settings.getGapLimit());
		Assert.assertEquals(1, settings.getMinBlockConfirm());
		Assert.assertEquals(10, settings.getMaxScriptWatch());
		Assert.assertEquals(10, settings.getMaxReconnectAttempts());
	}

	@Test
	public void testFromJson() {
		Settings settings = Settings.fromJson("{" +
				"\"nodeHost\": \"10.0.0.5\"," +
				"\"nodePort\": 8332," +
				"\"zmqPort\": 28332," +
				"\"rpcUser\": \"bob\"," +
				"\"walletName\": \"main\"," +
				"\"gapLimit\": 50," +
				"\"maxCacheSize\": 5" +
				"}");

		Assert.assertEquals("10.0.0.5", settings.getNodeHost());
		Assert.assertEquals(8332, settings.getNodePort());
		Assert.assertEquals("bob", settings.getRpcUser());
		Assert.assertEquals("main", settings.getWalletName());
		Assert.assertEquals("tcp://10.0.0.5:28332", settings.getZmqEndpoint());
		Assert.assertEquals(50, settings.getGapLimit());
		Assert.assertEquals(5, settings.getMaxCacheSize());
	}

	@Test
	public void testInvalidSettings() {
		String[] invalidJsons = {
				"{\"nodePort\": 70000}",
				"{\"zmqPort\": 0}",
				"{\"gapLimit\": 0}",
				"{\"maxCacheSize\": 0}",
				"{\"maxReconnectAttempts\": -1}"
		};

		for (String json : invalidJsons) {
			try {
				Settings.fromJson(json);
				Assert.fail("settings should be rejected: " + json);
			} catch (RuntimeException e) {
				// expected
			}
		}
	}

	@Test(expected = RuntimeException.class)
	public void testMissingSettingsFile() {
		Settings.fileInstance("no-such-settings-file.json");
	}
}
