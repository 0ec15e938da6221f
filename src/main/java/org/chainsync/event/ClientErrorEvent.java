package org.chainsync.event;

/**
 * Advisory protocol condition on the request socket: malformed line, or a response nobody is waiting for.
 */
public class ClientErrorEvent implements Event {

	public enum Reason {
		MALFORMED_RESPONSE,
		UNMATCHED_RESPONSE
	}

	private final Reason reason;
	private final String message;

	public ClientErrorEvent(Reason reason, String message) {
		this.reason = reason;
		this.message = message;
	}

	public Reason getReason() {
		return reason;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return String.format("%s: %s", this.reason, this.message);
	}
}
