package org.chainsync.wallet;

import org.chainsync.crosschain.ChainDataException;
import org.chainsync.repository.DataException;

/**
 * Walks successive derivation paths of an account role.
 */
public interface HdAccountIterator {

	@FunctionalInterface
	public interface PathVisitor {
		/**
		 * Called once per path, in order. Running <tt>halt</tt> stops the walk
		 * after this call returns.
		 */
		public void visit(String path, Runnable halt) throws ChainDataException, DataException;
	}

	/**
	 * Visits paths of <tt>role</tt> starting at <tt>startPath</tt> (inclusive),
	 * or at the role's first path if <tt>startPath</tt> is null.
	 */
	public void eachAccount(AccountRole role, String startPath, PathVisitor visitor) throws ChainDataException, DataException;

	/** Marks <tt>path</tt> as next unused receiving path. */
	public void updateLastPath(String path);

}
