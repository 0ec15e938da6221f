package org.chainsync.test.common;

import org.chainsync.data.wallet.DerivedAddress;
import org.chainsync.wallet.AddressType;
import org.chainsync.wallet.KeyPathManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps each path to a predictable address: <tt>m/84'/0'/0'/0/3</tt> becomes <tt>addr-0-3</tt>.
 */
public class FakeKeyPathManager implements KeyPathManager {

	public final List<String> derivedPaths = Collections.synchronizedList(new ArrayList<>());

	public static String addressFor(String path) {
		String[] levels = path.split("/");
		return "addr-" + levels[levels.length - 2] + "-" + levels[levels.length - 1];
	}

	public static DerivedAddress derive(String path) {
		String address = addressFor(path);
		return new DerivedAddress("sh-" + address, address, path, "02" + address, AddressType.P2WPKH);
	}

	@Override
	public DerivedAddress pathToScriptHash(String path, AddressType addressType) {
		this.derivedPaths.add(path);
		return derive(path);
	}
}
