/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.server.transport.FifoPendingResponseRegistry;
import io.mcpcalendar.server.transport.McpStreamableSession;
import io.mcpcalendar.server.transport.StdioServerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one MCP session over newline-delimited JSON-RPC on a pair of streams, by
 * default the process's stdin and stdout. Logging must stay off stdout in this mode.
 */
public class McpStdioServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpStdioServer.class);

	private final McpStreamableSession session;

	private final McpMessagePump pump;

	private final StdioServerTransport transport;

	private volatile boolean started;

	private McpStdioServer(Builder builder) {
		ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
		McpMessageProcessor processor = builder.processor != null ? builder.processor
				: McpServerMessageProcessor.withBuiltinTools(objectMapper);

		this.session = McpStreamableSession.open(builder.maxPending);
		this.pump = new McpMessagePump(this.session, processor, objectMapper);
		this.transport = new StdioServerTransport(objectMapper, this.session, builder.input, builder.output,
				builder.requestTimeout);
	}

	/**
	 * Starts the message pump and begins reading input.
	 * @return this server
	 */
	public McpStdioServer start() {
		if (this.started) {
			throw new IllegalStateException("Server already started");
		}
		this.started = true;
		this.pump.start();
		this.transport.start();
		return this;
	}

	public McpStreamableSession getSession() {
		return this.session;
	}

	/**
	 * Blocks the calling thread until input ends or the server is closed.
	 */
	public void await() {
		this.transport.awaitTermination().block();
	}

	@Override
	public void close() {
		logger.info("Shutting down MCP server...");
		this.transport.closeGracefully().block();
		this.pump.closeGracefully().block();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private InputStream input = System.in;

		private OutputStream output = System.out;

		private int maxPending = 1024;

		private Duration requestTimeout;

		private ObjectMapper objectMapper;

		private McpMessageProcessor processor;

		public Builder input(InputStream input) {
			this.input = input;
			return this;
		}

		public Builder output(OutputStream output) {
			this.output = output;
			return this;
		}

		/**
		 * @param maxPending cap on requests awaiting a reply, {@code 0} for no cap
		 * @return this builder
		 */
		public Builder maxPending(int maxPending) {
			this.maxPending = maxPending;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder processor(McpMessageProcessor processor) {
			this.processor = processor;
			return this;
		}

		public McpStdioServer build() {
			if (this.input == null || this.output == null) {
				throw new IllegalArgumentException("input and output must not be null");
			}
			if (this.maxPending < FifoPendingResponseRegistry.UNBOUNDED) {
				throw new IllegalArgumentException("maxPending must not be negative");
			}
			return new McpStdioServer(this);
		}

	}

}
