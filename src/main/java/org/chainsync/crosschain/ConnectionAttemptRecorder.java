package org.chainsync.crosschain;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded history of request-socket connection attempts, newest last.
 */
public class ConnectionAttemptRecorder {

	private final List<ConnectionAttempt> attempts;
	private final int limit;

	public ConnectionAttemptRecorder(int limit) {
		this.attempts = new ArrayList<>(limit);
		this.limit = limit;
	}

	public synchronized ConnectionAttempt recordAttempt(String endpoint, int attempt, boolean success, String notes) {
		ConnectionAttempt connectionAttempt
				= new ConnectionAttempt(endpoint, attempt, success, System.currentTimeMillis(), notes);

		this.attempts.add(connectionAttempt);

		while (this.attempts.size() > this.limit)
			this.attempts.remove(0);

		return connectionAttempt;
	}

	public int getLimit() {
		return limit;
	}

	public synchronized List<ConnectionAttempt> getAttempts() {
		return new ArrayList<>(this.attempts);
	}
}
