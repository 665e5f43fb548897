/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.cli;

/**
 * How the server talks to its client.
 */
public enum TransportMode {

	/** Newline-delimited JSON-RPC on stdin and stdout. */
	STDIO,

	/** Streamable HTTP at {@code /mcp}. */
	HTTP

}
