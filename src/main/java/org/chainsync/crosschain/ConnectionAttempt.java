package org.chainsync.crosschain;

import java.util.Objects;

public class ConnectionAttempt {

	private final String endpoint;
	private final int attempt;
	private final boolean success;
	private final long currentTimeMillis;
	private final String notes;

	public ConnectionAttempt(String endpoint, int attempt, boolean success, long currentTimeMillis, String notes) {
		this.endpoint = endpoint;
		this.attempt = attempt;
		this.success = success;
		this.currentTimeMillis = currentTimeMillis;
		this.notes = notes;
	}

	public String getEndpoint() {
		return endpoint;
	}

	/** Reconnect attempt number, 0 for the initial connect. */
	public int getAttempt() {
		return attempt;
	}

	public boolean isSuccess() {
		return success;
	}

	public long getCurrentTimeMillis() {
		return currentTimeMillis;
	}

	public String getNotes() {
		return notes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConnectionAttempt that = (ConnectionAttempt) o;
		return attempt == that.attempt && currentTimeMillis == that.currentTimeMillis && Objects.equals(endpoint, that.endpoint);
	}

	@Override
	public int hashCode() {
		return Objects.hash(endpoint, attempt, currentTimeMillis);
	}

	@Override
	public String toString() {
		return "ConnectionAttempt{" +
				"endpoint='" + endpoint + '\'' +
				", attempt=" + attempt +
				", success=" + success +
				", currentTimeMillis=" + currentTimeMillis +
				", notes='" + notes + '\'' +
				'}';
	}
}
