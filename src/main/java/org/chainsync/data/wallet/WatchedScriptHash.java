package org.chainsync.data.wallet;

/**
 * Address subscribed for new-transaction notifications, with the handle the provider returned.
 */
public class WatchedScriptHash {

	private final DerivedAddress derivedAddress;
	private final String handle;

	public WatchedScriptHash(DerivedAddress derivedAddress, String handle) {
		this.derivedAddress = derivedAddress;
		this.handle = handle;
	}

	public DerivedAddress getDerivedAddress() {
		return this.derivedAddress;
	}

	public String getScriptHash() {
		return this.derivedAddress.getScriptHash();
	}

	public String getAddress() {
		return this.derivedAddress.getAddress();
	}

	public String getPath() {
		return this.derivedAddress.getPath();
	}

	public String getHandle() {
		return this.handle;
	}

	@Override
	public String toString() {
		return String.format("{scriptHash: %s, address: %s, handle: %s}", getScriptHash(), getAddress(), this.handle);
	}
}
