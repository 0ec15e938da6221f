package org.chainsync.crosschain;

import java.nio.charset.StandardCharsets;

/**
 * ZMQ publisher topics used on the node's event socket.
 */
public enum NotificationTopic {
	HASHBLOCK("hashblock"),
	RAWTX("rawtx");

	public final String topic;

	NotificationTopic(String topic) {
		this.topic = topic;
	}

	public byte[] getSubscriptionBytes() {
		return this.topic.getBytes(StandardCharsets.UTF_8);
	}

	public static NotificationTopic fromMessageBytes(byte[] bytes) {
		String topic = new String(bytes, StandardCharsets.UTF_8);

		for (NotificationTopic notificationTopic : NotificationTopic.values())
			if (notificationTopic.topic.equals(topic))
				return notificationTopic;

		return null;
	}
}
