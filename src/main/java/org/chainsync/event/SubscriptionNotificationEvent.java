package org.chainsync.event;

/**
 * Push message received on the request socket, e.g. <tt>blockchain.scripthash.subscribe</tt>.
 */
public class SubscriptionNotificationEvent implements Event {

	private final String method;
	private final Object value;

	public SubscriptionNotificationEvent(String method, Object value) {
		this.method = method;
		this.value = value;
	}

	public String getMethod() {
		return method;
	}

	/** Last element of the notification's params: the channel/topic value delivered. */
	public Object getValue() {
		return value;
	}
}
