/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.spec;

public class McpTransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public McpTransportException(String message) {
		super(message);
	}

	public McpTransportException(String message, Throwable cause) {
		super(message, cause);
	}

	public McpTransportException(Throwable cause) {
		super(cause);
	}

}
