package org.chainsync.crosschain;

public enum ConnectionState {
	DISCONNECTED,
	CONNECTING,
	CONNECTED,
	CLOSED
}
