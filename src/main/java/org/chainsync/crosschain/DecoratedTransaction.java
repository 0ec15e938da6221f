package org.chainsync.crosschain;

import org.bitcoinj.core.Coin;

import java.util.Collections;
import java.util.List;

/**
 * Transaction with outputs resolved to addresses and inputs resolved to the outputs they spend.
 */
public class DecoratedTransaction {

	public final String txid;

	/** 0 if unconfirmed */
	public final int height;

	public final List<Output> outputs;
	public final List<Input> inputs;

	/** Aligned with {@link #outputs}: true if the output has a resolvable address. */
	public final List<Boolean> standardOutputs;
	/** Aligned with {@link #inputs}: true if the input spends an output with a resolvable address. */
	public final List<Boolean> standardInputs;

	/** Ids of parent transactions that are still unconfirmed. */
	public final List<String> unconfirmedInputs;

	public final Coin fee;

	public static class Output {
		/** null for non-standard outputs, e.g. OP_RETURN or bare multisig */
		public final String address;
		public final Coin value;
		public final String scriptHex;
		public final int index;
		public final String txid;
		public final int height;

		public Output(String address, Coin value, String scriptHex, int index, String txid, int height) {
			this.address = address;
			this.value = value;
			this.scriptHex = scriptHex;
			this.index = index;
			this.txid = txid;
			this.height = height;
		}

		public boolean isStandard() {
			return this.address != null;
		}

		/** Outpoint identifying this output. */
		public String getPoint() {
			return this.txid + ":" + this.index;
		}

		@Override
		public String toString() {
			return String.format("{address: %s, value: %s, index: %d}", this.address, this.value.toPlainString(), this.index);
		}
	}

	public static class Input {
		public final String address;
		public final Coin value;
		public final String scriptHex;
		/** Spending transaction */
		public final String txid;
		public final int height;
		public final String prevTxid;
		public final int prevIndex;
		public final int prevTxHeight;
		public final boolean coinbase;

		public Input(String address, Coin value, String scriptHex, String txid, int height,
				String prevTxid, int prevIndex, int prevTxHeight, boolean coinbase) {
			this.address = address;
			this.value = value;
			this.scriptHex = scriptHex;
			this.txid = txid;
			this.height = height;
			this.prevTxid = prevTxid;
			this.prevIndex = prevIndex;
			this.prevTxHeight = prevTxHeight;
			this.coinbase = coinbase;
		}

		/** Outpoint being spent. */
		public String getPoint() {
			return this.prevTxid + ":" + this.prevIndex;
		}

		@Override
		public String toString() {
			return String.format("{prev: %s, address: %s, value: %s}", getPoint(), this.address, this.value.toPlainString());
		}
	}

	public DecoratedTransaction(String txid, int height, List<Output> outputs, List<Input> inputs,
			List<Boolean> standardOutputs, List<Boolean> standardInputs, List<String> unconfirmedInputs, Coin fee) {
		this.txid = txid;
		this.height = height;
		this.outputs = Collections.unmodifiableList(outputs);
		this.inputs = Collections.unmodifiableList(inputs);
		this.standardOutputs = Collections.unmodifiableList(standardOutputs);
		this.standardInputs = Collections.unmodifiableList(standardInputs);
		this.unconfirmedInputs = Collections.unmodifiableList(unconfirmedInputs);
		this.fee = fee;
	}

	public boolean isConfirmed() {
		return this.height != TransactionRecord.UNCONFIRMED_HEIGHT;
	}

	@Override
	public String toString() {
		return String.format("txid %s, height %d, %d inputs, %d outputs, fee %s",
				this.txid, this.height, this.inputs.size(), this.outputs.size(), this.fee.toPlainString());
	}
}
