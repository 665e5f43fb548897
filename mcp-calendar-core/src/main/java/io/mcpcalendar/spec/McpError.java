/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.spec;

import io.mcpcalendar.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/**
 * A failure that maps onto a JSON-RPC error object.
 */
public class McpError extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public static Builder builder(int errorCode) {
		return new Builder(errorCode);
	}

	public static class Builder {

		private final int code;

		private String message;

		private Object data;

		private Builder(int code) {
			this.code = code;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder data(Object data) {
			this.data = data;
			return this;
		}

		public McpError build() {
			if (this.message == null) {
				throw new IllegalStateException("message must not be null");
			}
			return new McpError(new JSONRPCError(this.code, this.message, this.data));
		}

	}

}
