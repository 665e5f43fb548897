/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.server.transport.FifoPendingResponseRegistry;
import io.mcpcalendar.server.transport.HealthCheckServlet;
import io.mcpcalendar.server.transport.McpStreamableSession;
import io.mcpcalendar.server.transport.StreamableHttpServerTransportProvider;
import jakarta.servlet.http.HttpServlet;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Tomcat serving one MCP session at {@code /mcp} and a liveness probe at
 * {@code /health}.
 */
public class McpHttpServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpServer.class);

	private final String host;

	private final int port;

	private final McpStreamableSession session;

	private final McpMessagePump pump;

	private final StreamableHttpServerTransportProvider transport;

	private final Tomcat tomcat;

	private volatile boolean started;

	private McpHttpServer(Builder builder) {
		this.host = builder.host;
		this.port = builder.port;
		ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
		McpMessageProcessor processor = builder.processor != null ? builder.processor
				: McpServerMessageProcessor.withBuiltinTools(objectMapper);

		this.session = McpStreamableSession.open(builder.maxPending);
		this.pump = new McpMessagePump(this.session, processor, objectMapper);
		this.transport = StreamableHttpServerTransportProvider.builder()
			.withObjectMapper(objectMapper)
			.withSession(this.session)
			.withMaxBodyBytes(builder.maxBodyBytes)
			.withRequestTimeout(builder.requestTimeout)
			.build();
		this.tomcat = createTomcat();
	}

	private Tomcat createTomcat() {
		Tomcat tomcat = new Tomcat();
		tomcat.setHostname(this.host);
		tomcat.setPort(this.port);

		String baseDir = System.getProperty("java.io.tmpdir");
		tomcat.setBaseDir(baseDir);

		Context context = tomcat.addContext("", baseDir);
		addServlet(context, "mcpServlet", this.transport, StreamableHttpServerTransportProvider.DEFAULT_MCP_ENDPOINT);
		addServlet(context, "healthServlet", new HealthCheckServlet(), HealthCheckServlet.DEFAULT_HEALTH_ENDPOINT);

		Connector connector = tomcat.getConnector();
		connector.setProperty("address", this.host);
		return tomcat;
	}

	private static void addServlet(Context context, String name, HttpServlet servlet, String mapping) {
		Wrapper wrapper = context.createWrapper();
		wrapper.setName(name);
		wrapper.setServlet(servlet);
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		context.addChild(wrapper);
		context.addServletMappingDecoded(mapping, name);
	}

	/**
	 * Starts the message pump and the HTTP listener.
	 * @return this server
	 * @throws LifecycleException if Tomcat fails to start, for example because the port
	 * is taken
	 */
	public McpHttpServer start() throws LifecycleException {
		if (this.started) {
			throw new IllegalStateException("Server already started");
		}
		this.started = true;
		this.pump.start();
		try {
			this.tomcat.start();
		}
		catch (LifecycleException e) {
			logger.error("Failed to start Tomcat server", e);
			close();
			throw e;
		}
		logger.info("MCP server listening on http://{}:{}{} (session {})", this.host, getPort(),
				StreamableHttpServerTransportProvider.DEFAULT_MCP_ENDPOINT, this.session.getId());
		return this;
	}

	/**
	 * @return the bound port, which differs from the configured one when that was
	 * {@code 0}
	 */
	public int getPort() {
		int local = this.tomcat.getConnector().getLocalPort();
		return local > 0 ? local : this.port;
	}

	public McpStreamableSession getSession() {
		return this.session;
	}

	/**
	 * Blocks the calling thread until the server is stopped.
	 */
	public void await() {
		this.tomcat.getServer().await();
	}

	@Override
	public void close() {
		logger.info("Shutting down MCP server...");
		this.session.closeGracefully().block();
		this.pump.closeGracefully().block();
		try {
			this.tomcat.stop();
			this.tomcat.destroy();
		}
		catch (LifecycleException e) {
			logger.error("Error during Tomcat shutdown", e);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String host = "127.0.0.1";

		private int port = 8080;

		private int maxBodyBytes = StreamableHttpServerTransportProvider.DEFAULT_MAX_BODY_BYTES;

		private int maxPending = 1024;

		private Duration requestTimeout;

		private ObjectMapper objectMapper;

		private McpMessageProcessor processor;

		public Builder host(String host) {
			this.host = host;
			return this;
		}

		public Builder port(int port) {
			this.port = port;
			return this;
		}

		public Builder maxBodyBytes(int maxBodyBytes) {
			this.maxBodyBytes = maxBodyBytes;
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

		/**
		 * @param processor replaces the default dispatcher with its built-in tools
		 * @return this builder
		 */
		public Builder processor(McpMessageProcessor processor) {
			this.processor = processor;
			return this;
		}

		public McpHttpServer build() {
			if (this.port < 0 || this.port > 65535) {
				throw new IllegalArgumentException("port must be between 0 and 65535");
			}
			if (this.maxPending < FifoPendingResponseRegistry.UNBOUNDED) {
				throw new IllegalArgumentException("maxPending must not be negative");
			}
			return new McpHttpServer(this);
		}

	}

}
