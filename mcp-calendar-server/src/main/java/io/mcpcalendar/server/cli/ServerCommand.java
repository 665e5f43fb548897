/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.cli;

import java.time.Duration;
import java.util.Locale;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import io.mcpcalendar.server.McpHttpServer;
import io.mcpcalendar.server.McpStdioServer;
import io.mcpcalendar.server.transport.StreamableHttpServerTransportProvider;

/**
 * Command line options of the server. Options that only apply to HTTP are ignored
 * under stdio.
 */
@Parameters(commandDescription = "MCP Calendar Server over stdio or streamable HTTP")
public class ServerCommand {

	@Parameter(names = { "--transport", "-t" }, converter = TransportModeConverter.class,
			description = "Transport: stdio or http")
	public TransportMode transport = TransportMode.STDIO;

	@Parameter(names = "--host", description = "Address to bind")
	public String host = "127.0.0.1";

	@Parameter(names = { "--port", "-p" }, description = "HTTP port, 0 picks a free one")
	public int port = 8080;

	@Parameter(names = { "--log-level", "-l" },
			description = "Log level: trace, debug, info, notice, warning, error, critical")
	public String logLevel = "info";

	@Parameter(names = "--max-body-bytes", description = "Largest accepted request body")
	public int maxBodyBytes = StreamableHttpServerTransportProvider.DEFAULT_MAX_BODY_BYTES;

	@Parameter(names = "--max-pending", description = "Requests that may await a reply at once, 0 for no limit")
	public int maxPending = 1024;

	@Parameter(names = "--request-timeout", description = "Seconds a caller waits for its reply, 0 waits forever")
	public long requestTimeoutSeconds = 0;

	@Parameter(names = { "--help", "-h" }, help = true, description = "Show usage")
	public boolean help;

	public McpHttpServer.Builder toServerBuilder() {
		return McpHttpServer.builder()
			.host(this.host)
			.port(this.port)
			.maxBodyBytes(this.maxBodyBytes)
			.maxPending(this.maxPending)
			.requestTimeout(requestTimeout());
	}

	public McpStdioServer.Builder toStdioServerBuilder() {
		return McpStdioServer.builder().maxPending(this.maxPending).requestTimeout(requestTimeout());
	}

	private Duration requestTimeout() {
		return this.requestTimeoutSeconds > 0 ? Duration.ofSeconds(this.requestTimeoutSeconds) : null;
	}

	public static class TransportModeConverter implements IStringConverter<TransportMode> {

		@Override
		public TransportMode convert(String value) {
			try {
				return TransportMode.valueOf(value.toUpperCase(Locale.ROOT));
			}
			catch (IllegalArgumentException e) {
				throw new ParameterException("Unknown transport '" + value + "', expected stdio or http");
			}
		}

	}

}
