package org.chainsync.data.wallet;

import org.chainsync.wallet.AccountRole;

import java.util.EnumMap;
import java.util.Map;

public class SyncState {

	private final Map<AccountRole, AccountSyncState> accounts = new EnumMap<>(AccountRole.class);

	public SyncState() {
		for (AccountRole role : AccountRole.values())
			this.accounts.put(role, new AccountSyncState());
	}

	public AccountSyncState get(AccountRole role) {
		return this.accounts.get(role);
	}

	public void set(AccountRole role, AccountSyncState accountSyncState) {
		this.accounts.put(role, accountSyncState);
	}

	@Override
	public String toString() {
		return this.accounts.toString();
	}
}
