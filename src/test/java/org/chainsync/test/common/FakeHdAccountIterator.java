package org.chainsync.test.common;

import org.chainsync.crosschain.ChainDataException;
import org.chainsync.repository.DataException;
import org.chainsync.wallet.AccountRole;
import org.chainsync.wallet.DerivationPaths;
import org.chainsync.wallet.HdAccountIterator;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks BIP84 paths <tt>m/84'/0'/0'/{chain}/{index}</tt>, stopping after a fixed number of paths.
 */
public class FakeHdAccountIterator implements HdAccountIterator {

	private static final int MAX_PATHS = 100;

	public final List<String> visitedPaths = new ArrayList<>();
	public String lastPath = null;

	public static String path(AccountRole role, int index) {
		return "m/84'/0'/0'/" + role.chain + "/" + index;
	}

	@Override
	public void eachAccount(AccountRole role, String startPath, PathVisitor visitor) throws ChainDataException, DataException {
		int start = startPath == null ? 0 : DerivationPaths.getIndex(startPath);

		boolean[] halted = new boolean[1];
		for (int index = start; index < start + MAX_PATHS && !halted[0]; ++index) {
			String path = path(role, index);
			this.visitedPaths.add(path);

			visitor.visit(path, () -> halted[0] = true);
		}
	}

	@Override
	public void updateLastPath(String path) {
		this.lastPath = path;
	}
}
