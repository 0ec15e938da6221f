package org.chainsync.wallet;

import org.chainsync.data.wallet.DerivedAddress;

/**
 * Derives wallet addresses from HD paths.
 */
public interface KeyPathManager {

	public DerivedAddress pathToScriptHash(String path, AddressType addressType);

}
