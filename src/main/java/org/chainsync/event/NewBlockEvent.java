package org.chainsync.event;

public class NewBlockEvent implements Event {

	private final int height;
	private final String hex;

	public NewBlockEvent(int height, String hex) {
		this.height = height;
		this.hex = hex;
	}

	public int getHeight() {
		return height;
	}

	/** Raw serialized block, hex encoded. */
	public String getHex() {
		return hex;
	}
}
