package org.chainsync.crosschain;

import com.google.common.hash.HashCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZFrame;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;
import org.zeromq.ZMsg;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Subscriber side of the node's ZMQ publisher.
 * <p>
 * One daemon thread owns the ZMQ context and socket. Topic (un)subscriptions are queued
 * and applied by that thread, which wakes at least once per poll interval to apply them
 * and to notice {@link #close()}.
 */
public class EventSocket {

	private static final Logger LOGGER = LogManager.getLogger(EventSocket.class);

	public interface NotificationCallback {
		void onNotification(NotificationTopic topic, String payloadHex);
	}

	private static class SubscriptionChange {
		final NotificationTopic topic;
		final boolean subscribe;

		SubscriptionChange(NotificationTopic topic, boolean subscribe) {
			this.topic = topic;
			this.subscribe = subscribe;
		}
	}

	private final String endpoint;
	private final int pollInterval;
	private final NotificationCallback callback;
	private final Queue<SubscriptionChange> subscriptionChanges = new ConcurrentLinkedQueue<>();

	private volatile boolean running = false;
	private Thread thread;

	public EventSocket(String endpoint, int pollInterval, NotificationCallback callback) {
		this.endpoint = endpoint;
		this.pollInterval = pollInterval;
		this.callback = callback;
	}

	public synchronized void start() {
		if (this.running)
			return;

		this.running = true;

		this.thread = new Thread(this::run, "ZMQ Event Socket - " + this.endpoint);
		this.thread.setDaemon(true);
		this.thread.start();
	}

	public void subscribe(NotificationTopic topic) {
		this.subscriptionChanges.add(new SubscriptionChange(topic, true));
	}

	public void unsubscribe(NotificationTopic topic) {
		this.subscriptionChanges.add(new SubscriptionChange(topic, false));
	}

	public boolean isRunning() {
		return this.running;
	}

	public String getEndpoint() {
		return this.endpoint;
	}

	/** Stops the loop and waits briefly for the socket to be released. */
	public void close() {
		Thread loopThread;
		synchronized (this) {
			this.running = false;
			loopThread = this.thread;
		}

		if (loopThread == null || loopThread == Thread.currentThread())
			return;

		try {
			loopThread.join(this.pollInterval * 4L);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private void run() {
		try (ZContext context = new ZContext()) {
			ZMQ.Socket socket = context.createSocket(SocketType.SUB);
			socket.setReceiveTimeOut(this.pollInterval);
			socket.setLinger(0);
			socket.connect(this.endpoint);

			LOGGER.info("Listening to {}", this.endpoint);

			while (this.running && !Thread.currentThread().isInterrupted()) {
				applySubscriptionChanges(socket);

				ZMsg message = ZMsg.recvMsg(socket);
				if (message == null)
					// Poll timeout
					continue;

				dispatch(message);
			}
		} catch (ZMQException e) {
			if (this.running)
				LOGGER.warn(String.format("Event socket %s failed: %s", this.endpoint, e.getMessage()));
		} finally {
			this.running = false;
			LOGGER.info("Stopped listening to {}", this.endpoint);
		}
	}

	private void applySubscriptionChanges(ZMQ.Socket socket) {
		SubscriptionChange change;
		while ((change = this.subscriptionChanges.poll()) != null) {
			if (change.subscribe)
				socket.subscribe(change.topic.getSubscriptionBytes());
			else
				socket.unsubscribe(change.topic.getSubscriptionBytes());

			LOGGER.trace("{} {} on {}", change.subscribe ? "Subscribed to" : "Unsubscribed from", change.topic.topic, this.endpoint);
		}
	}

	private void dispatch(ZMsg message) {
		try {
			// Frames: topic, body, sequence number
			ZFrame topicFrame = message.poll();
			ZFrame bodyFrame = message.poll();
			if (topicFrame == null || bodyFrame == null)
				return;

			NotificationTopic topic = NotificationTopic.fromMessageBytes(topicFrame.getData());
			if (topic == null)
				return;

			String payloadHex = HashCode.fromBytes(bodyFrame.getData()).toString();
			LOGGER.trace(() -> String.format("%s - %s: %s", this.endpoint, topic.topic, payloadHex));

			this.callback.onNotification(topic, payloadHex);
		} catch (RuntimeException e) {
			LOGGER.error(String.format("Unable to dispatch notification from %s", this.endpoint), e);
		} finally {
			message.destroy();
		}
	}
}
