package org.chainsync.test.common;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a Bitcoin Core RPC port.
 * <p>
 * Requests are answered by the {@link Responder}; any request it declines is queued for
 * the test to answer by hand, in whatever order it likes.
 */
public class FakeNode implements AutoCloseable {

	public static class Request {
		public final String id;
		public final String method;
		public final JSONArray params;
		public final String requestLine;
		public final String authorization;

		Request(String id, String method, JSONArray params, String requestLine, String authorization) {
			this.id = id;
			this.method = method;
			this.params = params;
			this.requestLine = requestLine;
			this.authorization = authorization;
		}
	}

	@FunctionalInterface
	public interface Responder {
		/** Returns result to send, or {@link #DECLINE} to queue the request. */
		Object respond(Request request);
	}

	public static final Object DECLINE = new Object();

	public static final int BLOCK_COUNT = 100;

	private final ServerSocket serverSocket;
	private final Thread acceptThread;
	private final BlockingQueue<Request> unanswered = new LinkedBlockingQueue<>();
	private final List<Request> received = Collections.synchronizedList(new ArrayList<>());
	private final AtomicInteger connectionCount = new AtomicInteger();
	private final AtomicInteger activeClientCount = new AtomicInteger();

	private volatile Responder responder = FakeNode::answerBlockCount;
	private volatile Socket client;
	private volatile boolean closed = false;

	public FakeNode() throws IOException {
		this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());

		this.acceptThread = new Thread(this::acceptLoop, "Fake Node Acceptor");
		this.acceptThread.setDaemon(true);
		this.acceptThread.start();
	}

	public static int findFreePort() throws IOException {
		try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			return socket.getLocalPort();
		}
	}

	/** Answers only <tt>getblockcount</tt>, queueing everything else. */
	public static Object answerBlockCount(Request request) {
		if (request.method.equals("getblockcount"))
			return (long) BLOCK_COUNT;

		return DECLINE;
	}

	public int getPort() {
		return this.serverSocket.getLocalPort();
	}

	public void setResponder(Responder responder) {
		this.responder = responder;
	}

	public int getConnectionCount() {
		return this.connectionCount.get();
	}

	/** Client connections whose reader is still running, i.e. neither side has closed them. */
	public int getActiveClientCount() {
		return this.activeClientCount.get();
	}

	public List<Request> getReceived() {
		synchronized (this.received) {
			return new ArrayList<>(this.received);
		}
	}

	public Request takeRequest() throws InterruptedException {
		Request request = this.unanswered.poll(5, TimeUnit.SECONDS);
		if (request == null)
			throw new AssertionError("no request arrived at fake node");

		return request;
	}

	public void reply(Request request, Object result) throws IOException {
		send(httpResponse(resultJson(request.id, result)));
	}

	public void replyError(Request request, int code, String message) throws IOException {
		send(httpResponse(errorJson(request.id, code, message)));
	}

	/** Writes raw bytes to the connected client. */
	public synchronized void send(String data) throws IOException {
		Socket socket = this.client;
		if (socket == null)
			throw new IOException("no client connected");

		OutputStream outputStream = socket.getOutputStream();
		outputStream.write(data.getBytes(StandardCharsets.UTF_8));
		outputStream.flush();
	}

	/** Closes the current client connection, leaving the port open for reconnects. */
	public void dropClient() throws IOException {
		Socket socket = this.client;
		if (socket != null)
			socket.close();
	}

	@SuppressWarnings("unchecked")
	public static String resultJson(String id, Object result) {
		JSONObject response = new JSONObject();
		response.put("result", result);
		response.put("error", null);
		response.put("id", id);
		return response.toJSONString();
	}

	@SuppressWarnings("unchecked")
	public static String errorJson(String id, int code, String message) {
		JSONObject error = new JSONObject();
		error.put("code", (long) code);
		error.put("message", message);

		JSONObject response = new JSONObject();
		response.put("result", null);
		response.put("error", error);
		response.put("id", id);
		return response.toJSONString();
	}

	public static String httpResponse(String... bodies) {
		StringBuilder body = new StringBuilder();
		for (String json : bodies)
			body.append(json).append('\n');

		int length = body.toString().getBytes(StandardCharsets.UTF_8).length;

		return "HTTP/1.1 200 OK\r\n" +
				"Content-Type: application/json\r\n" +
				"Content-Length: " + length + "\r\n" +
				"\r\n" +
				body;
	}

	private void acceptLoop() {
		while (!this.closed) {
			try {
				Socket socket = this.serverSocket.accept();
				this.client = socket;
				this.connectionCount.incrementAndGet();
				this.activeClientCount.incrementAndGet();

				Thread reader = new Thread(() -> readLoop(socket), "Fake Node Reader");
				reader.setDaemon(true);
				reader.start();
			} catch (IOException e) {
				if (!this.closed)
					throw new AssertionError("fake node accept failed", e);
			}
		}
	}

	private void readLoop(Socket socket) {
		try (DataInputStream in = new DataInputStream(socket.getInputStream())) {
			while (true) {
				String requestLine = readLine(in);
				if (requestLine == null)
					return;

				if (requestLine.isEmpty())
					continue;

				int contentLength = 0;
				String authorization = null;

				String header;
				while ((header = readLine(in)) != null && !header.isEmpty()) {
					int colon = header.indexOf(':');
					String name = header.substring(0, colon).trim().toLowerCase(Locale.ROOT);
					String value = header.substring(colon + 1).trim();

					if (name.equals("content-length"))
						contentLength = Integer.parseInt(value);
					else if (name.equals("authorization"))
						authorization = value;
				}

				byte[] body = new byte[contentLength];
				in.readFully(body);

				JSONObject json = (JSONObject) JSONValue.parse(new String(body, StandardCharsets.UTF_8));
				Request request = new Request(String.valueOf(json.get("id")), (String) json.get("method"),
						(JSONArray) json.get("params"), requestLine, authorization);

				this.received.add(request);

				Object result = this.responder.respond(request);
				if (result == DECLINE)
					this.unanswered.add(request);
				else
					reply(request, result);
			}
		} catch (SocketException e) {
			// Client went away
		} catch (IOException e) {
			if (!this.closed && !socket.isClosed())
				throw new AssertionError("fake node read failed", e);
		} finally {
			this.activeClientCount.decrementAndGet();
		}
	}

	private static String readLine(InputStream in) throws IOException {
		ByteArrayOutputStream line = new ByteArrayOutputStream();

		int b;
		while ((b = in.read()) != -1) {
			if (b == '\n')
				return line.toString(StandardCharsets.UTF_8).replace("\r", "");

			line.write(b);
		}

		return line.size() == 0 ? null : line.toString(StandardCharsets.UTF_8);
	}

	@Override
	public void close() throws IOException {
		this.closed = true;
		dropClient();
		this.serverSocket.close();
	}
}
