package org.chainsync.test.crosschain;

import org.chainsync.crosschain.ChainDataException;
import org.json.simple.JSONObject;
import org.junit.Assert;
import org.junit.Test;

import static org.chainsync.test.common.TestUtils.json;

public class ChainDataExceptionTests {

	@Test
	public void testRemoteErrorCode() {
		JSONObject error = json("{'code': -8, 'message': 'Block height out of range'}");

		ChainDataException.RemoteException e = new ChainDataException.RemoteException(error, "getblockhash");

		Assert.assertEquals(Integer.valueOf(-8), e.getErrorCode());
		Assert.assertEquals("getblockhash", e.getMethod());
		Assert.assertSame(error, e.getError());
		Assert.assertEquals("RPC Error: " + error.toJSONString() + " - getblockhash", e.getMessage());
	}

	@Test
	public void testRemoteErrorWithoutCode() {
		ChainDataException.RemoteException e = new ChainDataException.RemoteException("wallet locked", "sendrawtransaction");

		Assert.assertNull(e.getErrorCode());
		Assert.assertEquals("RPC Error: \"wallet locked\" - sendrawtransaction", e.getMessage());
	}
}
