package org.chainsync.data.wallet;

import org.chainsync.wallet.AddressType;

import java.util.Objects;

public class DerivedAddress {

	private final String scriptHash;
	private final String address;
	private final String path;
	private final String publicKey;
	private final AddressType addressType;

	public DerivedAddress(String scriptHash, String address, String path, String publicKey, AddressType addressType) {
		this.scriptHash = scriptHash;
		this.address = address;
		this.path = path;
		this.publicKey = publicKey;
		this.addressType = addressType;
	}

	public String getScriptHash() {
		return this.scriptHash;
	}

	public String getAddress() {
		return this.address;
	}

	public String getPath() {
		return this.path;
	}

	/** Hex-encoded, may be null if not known */
	public String getPublicKey() {
		return this.publicKey;
	}

	public AddressType getAddressType() {
		return this.addressType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DerivedAddress that = (DerivedAddress) o;
		return Objects.equals(scriptHash, that.scriptHash) && Objects.equals(address, that.address) && Objects.equals(path, that.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scriptHash, address, path);
	}

	@Override
	public String toString() {
		return String.format("%s (%s)", this.address, this.path);
	}
}
