package org.chainsync.wallet;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for BIP32 path strings such as <tt>m/84'/0'/0'/0/5</tt>.
 */
public abstract class DerivationPaths {

	private static final Splitter PATH_SPLITTER = Splitter.on('/').trimResults();
	private static final Joiner PATH_JOINER = Joiner.on('/');
	private static final String HARDENED_MARKER = "'";

	private DerivationPaths() {
	}

	/**
	 * Returns address type implied by the path's purpose level.
	 *
	 * @throws IllegalArgumentException if path is malformed or purpose is unsupported
	 */
	public static AddressType getAddressType(String path) {
		List<String> levels = levels(path);
		if (levels.size() < 2)
			throw new IllegalArgumentException("no purpose in path " + path);

		int purpose = index(levels.get(1), path);

		AddressType addressType = AddressType.fromPurpose(purpose);
		if (addressType == null)
			throw new IllegalArgumentException("unsupported purpose " + purpose + " in path " + path);

		return addressType;
	}

	/** Returns path with its final index incremented, keeping hardening. */
	public static String bumpIndex(String path) {
		List<String> levels = new ArrayList<>(levels(path));
		if (levels.size() < 2)
			throw new IllegalArgumentException("no index in path " + path);

		String last = levels.get(levels.size() - 1);
		boolean hardened = last.endsWith(HARDENED_MARKER);

		levels.set(levels.size() - 1, (index(last, path) + 1) + (hardened ? HARDENED_MARKER : ""));

		return PATH_JOINER.join(levels);
	}

	/** Returns final index of path. */
	public static int getIndex(String path) {
		List<String> levels = levels(path);
		return index(levels.get(levels.size() - 1), path);
	}

	private static List<String> levels(String path) {
		if (path == null || path.isEmpty())
			throw new IllegalArgumentException("empty path");

		List<String> levels = PATH_SPLITTER.splitToList(path);
		if (!levels.get(0).equalsIgnoreCase("m"))
			throw new IllegalArgumentException("path must start at master key: " + path);

		return levels;
	}

	private static int index(String level, String path) {
		String digits = level.endsWith(HARDENED_MARKER) ? level.substring(0, level.length() - 1) : level;

		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("bad level '" + level + "' in path " + path, e);
		}
	}
}
