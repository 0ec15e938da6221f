package org.chainsync.wallet;

/**
 * Output script form used for addresses of a derivation path.
 */
public enum AddressType {
	P2PKH(44),
	P2SH_P2WPKH(49),
	P2WPKH(84),
	P2TR(86);

	public final int purpose;

	AddressType(int purpose) {
		this.purpose = purpose;
	}

	public static AddressType fromPurpose(int purpose) {
		for (AddressType addressType : AddressType.values())
			if (addressType.purpose == purpose)
				return addressType;

		return null;
	}
}
