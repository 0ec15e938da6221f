package org.chainsync.wallet;

public class SyncException extends Exception {

	private static final long serialVersionUID = 6416213085468187634L;

	public SyncException(String message) {
		super(message);
	}

	public SyncException(String message, Throwable cause) {
		super(message, cause);
	}

}
