package org.chainsync.crosschain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

/**
 * Request socket to the node.
 * <p>
 * Writes are serialized; a dedicated reader thread splits inbound data on newlines and
 * hands each line to the {@link Handler}, so responses for pipelined requests can arrive
 * in any order and several to a single read.
 */
public class NodeConnection {

	private static final Logger LOGGER = LogManager.getLogger(NodeConnection.class);

	public interface Handler {
		void onLine(NodeConnection connection, String line);

		/** @param cause null if the peer closed the stream cleanly */
		void onClose(NodeConnection connection, IOException cause);
	}

	private final Object writeLock = new Object();
	private final SocketAddress endpoint;
	private final Handler handler;

	private Socket socket;
	private Thread readerThread;
	private volatile boolean closing = false;

	private NodeConnection(SocketAddress endpoint, Handler handler) {
		this.endpoint = endpoint;
		this.handler = handler;
	}

	public static NodeConnection open(SocketAddress endpoint, int timeout, Handler handler) throws IOException {
		NodeConnection instance = new NodeConnection(endpoint, handler);

		instance.init(timeout);

		return instance;
	}

	private void init(int timeout) throws IOException {
		this.socket = new Socket();
		this.socket.connect(this.endpoint, timeout);
		this.socket.setTcpNoDelay(true);
		this.socket.setKeepAlive(true);

	}

	/** Starts delivering inbound lines to the handler. */
	public synchronized void startReading() throws IOException {
		if (this.readerThread != null)
			return;

		InputStream inputStream = this.socket.getInputStream();

		this.readerThread = new Thread(() -> readLoop(inputStream), "Node Connection Reader - " + this.endpoint);
		this.readerThread.setDaemon(true);
		this.readerThread.start();
	}

	private void readLoop(InputStream inputStream) {
		Scanner scanner = new Scanner(inputStream, StandardCharsets.UTF_8);
		scanner.useDelimiter("\n");

		try {
			while (scanner.hasNext()) {
				String line = scanner.next();

				try {
					this.handler.onLine(this, line);
				} catch (RuntimeException e) {
					LOGGER.error(String.format("Unable to handle line from %s", this.endpoint), e);
				}
			}
		} finally {
			IOException cause = this.closing ? null : scanner.ioException();
			LOGGER.debug("Reader for {} finished{}", this.endpoint, cause == null ? "" : ": " + cause.getMessage());

			// Peer gone, release our end too
			closeSocket();

			this.handler.onClose(this, cause);
		}
	}

	public void write(byte[] bytes) throws IOException {
		synchronized (this.writeLock) {
			if (this.socket == null || this.socket.isClosed())
				throw new IOException("socket is closed");

			this.socket.getOutputStream().write(bytes);
			this.socket.getOutputStream().flush();
		}
	}

	public boolean isOpen() {
		Socket currentSocket = this.socket;
		return currentSocket != null && !currentSocket.isClosed() && !this.closing;
	}

	public SocketAddress getEndpoint() {
		return this.endpoint;
	}

	/** Closes the socket; the reader thread then reports {@link Handler#onClose} with a null cause. */
	public void close() {
		this.closing = true;

		closeSocket();
	}

	private void closeSocket() {
		synchronized (this.writeLock) {
			if (this.socket != null && !this.socket.isClosed())
				try {
					this.socket.close();
				} catch (IOException e) {
					LOGGER.debug("Error closing socket to {}: {}", this.endpoint, e.getMessage());
				}
		}
	}
}
