package org.chainsync.test.crosschain;

import org.chainsync.crosschain.NodeConnection;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class NodeConnectionTests {

	private ServerSocket serverSocket;

	private final List<String> lines = new CopyOnWriteArrayList<>();
	private final CountDownLatch closed = new CountDownLatch(1);

	private final NodeConnection.Handler handler = new NodeConnection.Handler() {
		@Override
		public void onLine(NodeConnection connection, String line) {
			lines.add(line);
		}

		@Override
		public void onClose(NodeConnection connection, IOException cause) {
			closed.countDown();
		}
	};

	@Before
	public void beforeTest() throws IOException {
		this.serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
	}

	@After
	public void afterTest() throws IOException {
		this.serverSocket.close();
	}

	private NodeConnection open() throws IOException {
		return NodeConnection.open(new InetSocketAddress(InetAddress.getLoopbackAddress(), this.serverSocket.getLocalPort()), 1000, this.handler);
	}

	@Test
	public void testLinesDelivered() throws Exception {
		NodeConnection connection = open();
		connection.startReading();

		try (Socket accepted = this.serverSocket.accept()) {
			accepted.getOutputStream().write("first\nsecond\n".getBytes(StandardCharsets.UTF_8));
			accepted.getOutputStream().flush();
			accepted.shutdownOutput();

			Assert.assertTrue(this.closed.await(5, TimeUnit.SECONDS));
		}

		Assert.assertEquals(List.of("first", "second"), this.lines);
	}

	@Test
	public void testSocketReleasedWhenPeerCloses() throws Exception {
		NodeConnection connection = open();
		connection.startReading();

		try (Socket accepted = this.serverSocket.accept()) {
			accepted.setSoTimeout(5000);

			// Peer finishes sending but keeps reading, as a half-closed node would
			accepted.shutdownOutput();

			Assert.assertTrue(this.closed.await(5, TimeUnit.SECONDS));
			Assert.assertFalse(connection.isOpen());

			// Our end was closed too, so the peer sees end of stream
			InputStream peerInput = accepted.getInputStream();
			Assert.assertEquals(-1, peerInput.read());
		}

		try {
			connection.write("ping\n".getBytes(StandardCharsets.UTF_8));
			Assert.fail("write to released socket should fail");
		} catch (IOException e) {
			// expected
		}
	}

	@Test
	public void testCloseReportsCleanly() throws Exception {
		NodeConnection connection = open();
		connection.startReading();

		try (Socket accepted = this.serverSocket.accept()) {
			connection.close();

			Assert.assertTrue(this.closed.await(5, TimeUnit.SECONDS));
			Assert.assertFalse(connection.isOpen());
		}
	}
}
