package org.chainsync.crosschain;

import org.json.simple.JSONAware;
import org.json.simple.JSONValue;

import java.util.Map;

@SuppressWarnings("serial")
public class ChainDataException extends Exception {

	public ChainDataException() {
		super();
	}

	public ChainDataException(String message) {
		super(message);
	}

	public ChainDataException(String message, Throwable cause) {
		super(message, cause);
	}

	public static class NotConnectedException extends ChainDataException {

		public NotConnectedException() {
			super("client not connected");
		}

		public NotConnectedException(String message) {
			super(message);
		}
	}

	public static class ClosedException extends ChainDataException {

		public ClosedException() {
			super("client closed");
		}
	}

	/** Reconnect attempts exhausted. */
	public static class ReconnectException extends ChainDataException {

		public ReconnectException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	/** Error reported by the node for a specific RPC call. */
	public static class RemoteException extends ChainDataException {

		private final Object error;
		private final String method;
		private final Integer errorCode;

		public RemoteException(Object error, String method) {
			super(String.format("RPC Error: %s - %s", toJson(error), method));
			this.error = error;
			this.method = method;
			this.errorCode = parseCode(error);
		}

		/** Raw error payload, usually a JSONObject with <tt>code</tt> and <tt>message</tt>. */
		public Object getError() {
			return this.error;
		}

		public String getMethod() {
			return this.method;
		}

		public Integer getErrorCode() {
			return this.errorCode;
		}

		private static String toJson(Object error) {
			if (error instanceof JSONAware)
				return ((JSONAware) error).toJSONString();

			return JSONValue.toJSONString(error);
		}

		private static Integer parseCode(Object error) {
			if (!(error instanceof Map))
				return null;

			Object codeObj = ((Map<?, ?>) error).get("code");
			if (!(codeObj instanceof Number))
				return null;

			return ((Number) codeObj).intValue();
		}
	}

	/** Response arrived but did not have the shape the call expects. */
	public static class ProtocolException extends ChainDataException {

		public ProtocolException(String message) {
			super(message);
		}
	}

}
