/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.spec.AsyncCloseable;
import io.mcpcalendar.spec.HttpHeaders;
import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTooManyRequestsException;
import io.mcpcalendar.spec.McpTransportException;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Servlet terminating the streamable HTTP endpoint of a single
 * {@link McpStreamableSession}.
 * <ul>
 * <li>{@code POST} with a request (a message carrying an {@code id} and a
 * {@code method}): the request is registered and published in one step, the call is
 * suspended with servlet async processing and completed with the correlated reply.</li>
 * <li>{@code POST} with anything else: published and answered {@code 202 Accepted}
 * immediately.</li>
 * <li>{@code DELETE}: terminates the session, cancelling every pending caller.
 * Idempotent.</li>
 * </ul>
 * Bodies larger than the configured cap are rejected before they are decoded.
 */
@WebServlet(asyncSupported = true)
public class StreamableHttpServerTransportProvider extends HttpServlet implements AsyncCloseable {

	private static final long serialVersionUID = 1L;

	/**
	 * Logger for this class
	 */
	private static final Logger logger = LoggerFactory.getLogger(StreamableHttpServerTransportProvider.class);

	public static final String APPLICATION_JSON = "application/json";

	public static final String UTF_8 = "UTF-8";

	public static final String DEFAULT_MCP_ENDPOINT = "/mcp";

	public static final int DEFAULT_MAX_BODY_BYTES = 1_048_576;

	static final int SC_TOO_MANY_REQUESTS = 429;

	private final transient ObjectMapper objectMapper;

	private final transient McpStreamableSession session;

	private final int maxBodyBytes;

	private final Duration requestTimeout;

	private StreamableHttpServerTransportProvider(ObjectMapper objectMapper, McpStreamableSession session,
			int maxBodyBytes, Duration requestTimeout) {
		this.objectMapper = objectMapper;
		this.session = session;
		this.maxBodyBytes = maxBodyBytes;
		this.requestTimeout = requestTimeout;
	}

	public McpStreamableSession getSession() {
		return this.session;
	}

	@Override
	protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		if (!acceptSessionHeader(req, resp)) {
			return;
		}
		if (!this.session.isOpen()) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Session terminated");
			return;
		}

		if (req.getContentLengthLong() > this.maxBodyBytes) {
			rejectTooLarge(resp);
			return;
		}
		byte[] body = readBody(req);
		if (body == null) {
			rejectTooLarge(resp);
			return;
		}

		final McpSchema.JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, body);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.debug("Rejecting undecodable message: {}", e.getMessage());
			resp.sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid JSON-RPC message");
			return;
		}

		if (message instanceof McpSchema.JSONRPCRequest request) {
			handleRequest(request, req, resp);
		}
		else {
			handleNotification(message, resp);
		}
	}

	private void handleNotification(McpSchema.JSONRPCMessage message, HttpServletResponse resp) throws IOException {
		try {
			this.session.submitNotification(message);
		}
		catch (McpSessionClosedException e) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Session terminated");
			return;
		}
		resp.setHeader(HttpHeaders.MCP_SESSION_ID, this.session.getId());
		resp.setStatus(HttpServletResponse.SC_ACCEPTED);
	}

	private void handleRequest(McpSchema.JSONRPCRequest request, HttpServletRequest req, HttpServletResponse resp)
			throws IOException {
		final PendingResponse pending;
		try {
			pending = this.session.submitRequest(request);
		}
		catch (McpSessionClosedException e) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Session terminated");
			return;
		}
		catch (McpTooManyRequestsException e) {
			logger.warn("Rejecting request {}: {}", request.id(), e.getMessage());
			resp.setHeader(HttpHeaders.RETRY_AFTER, "1");
			resp.sendError(SC_TOO_MANY_REQUESTS, e.getMessage());
			return;
		}
		catch (McpTransportException e) {
			logger.error("Failed to accept request {}", request.id(), e);
			resp.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Failed to accept request");
			return;
		}

		final AsyncContext asyncContext = req.startAsync();
		asyncContext.setTimeout(0);

		this.session.registry()
			.awaitResolution(pending, this.requestTimeout)
			// never write to the client on the thread that delivered the reply
			.publishOn(Schedulers.boundedElastic())
			.subscribe(outcome -> complete(asyncContext, request, outcome), error -> {
				logger.error("Failed awaiting reply for request {}", request.id(), error);
				try {
					sendError((HttpServletResponse) asyncContext.getResponse(),
							HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Failed awaiting reply");
				}
				finally {
					asyncContext.complete();
				}
			});
	}

	private void complete(AsyncContext asyncContext, McpSchema.JSONRPCRequest request, ResponseOutcome outcome) {
		HttpServletResponse resp = (HttpServletResponse) asyncContext.getResponse();
		try {
			if (outcome instanceof ResponseOutcome.Delivered delivered) {
				writeJson(resp, HttpServletResponse.SC_OK, delivered.payload());
			}
			else if (outcome instanceof ResponseOutcome.Cancelled cancelled) {
				writeJson(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, encodeError(request.id(),
						McpSchema.ErrorCodes.CONNECTION_CLOSED, "Session terminated: " + cancelled.reason()));
			}
			else if (outcome instanceof ResponseOutcome.TimedOut timedOut) {
				writeJson(resp, HttpServletResponse.SC_GATEWAY_TIMEOUT, encodeError(request.id(),
						McpSchema.ErrorCodes.REQUEST_TIMEOUT,
						"Request timed out after " + timedOut.timeout().toMillis() + " ms"));
			}
		}
		catch (IOException e) {
			logger.debug("Client of request {} disconnected before the reply was written", request.id());
		}
		finally {
			asyncContext.complete();
		}
	}

	@Override
	protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		if (!acceptSessionHeader(req, resp)) {
			return;
		}
		if (!this.session.terminate("Session terminated by client")) {
			logger.debug("Session {} already terminated", this.session.getId());
		}
		resp.setStatus(HttpServletResponse.SC_OK);
	}

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		// no server-initiated stream is offered
		resp.setHeader("Allow", "POST, DELETE");
		resp.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
	}

	/**
	 * A caller echoing the id of another session is talking to a stale session.
	 */
	private boolean acceptSessionHeader(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		String sessionId = req.getHeader(HttpHeaders.MCP_SESSION_ID);
		if (sessionId != null && !sessionId.equals(this.session.getId())) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Session not found");
			return false;
		}
		return true;
	}

	/**
	 * @return the body, or {@code null} if it exceeds the cap
	 */
	private byte[] readBody(HttpServletRequest req) throws IOException {
		try (InputStream in = req.getInputStream()) {
			byte[] body = in.readNBytes(this.maxBodyBytes + 1);
			return body.length > this.maxBodyBytes ? null : body;
		}
	}

	private void rejectTooLarge(HttpServletResponse resp) throws IOException {
		resp.sendError(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE,
				"Request body exceeds " + this.maxBodyBytes + " bytes");
	}

	private void writeJson(HttpServletResponse resp, int status, String payload) throws IOException {
		byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
		resp.setStatus(status);
		resp.setContentType(APPLICATION_JSON);
		resp.setCharacterEncoding(UTF_8);
		resp.setHeader(HttpHeaders.MCP_SESSION_ID, this.session.getId());
		resp.setContentLength(bytes.length);
		OutputStream out = resp.getOutputStream();
		out.write(bytes);
		out.flush();
	}

	private String encodeError(Object id, int code, String message) {
		try {
			return this.objectMapper.writeValueAsString(McpSchema.JSONRPCResponse.error(id, code, message));
		}
		catch (JsonProcessingException e) {
			throw new McpTransportException("Failed to encode error reply", e);
		}
	}

	private void sendError(HttpServletResponse resp, int code, String msg) {
		try {
			resp.sendError(code, msg);
		}
		catch (IOException | IllegalStateException e) {
			logger.debug("Exception during send error: {}", e.getMessage());
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return this.session.closeGracefully();
	}

	@Override
	public void destroy() {
		closeGracefully().block();
		super.destroy();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link StreamableHttpServerTransportProvider}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private McpStreamableSession session;

		private int maxBodyBytes = DEFAULT_MAX_BODY_BYTES;

		private Duration requestTimeout;

		public Builder withObjectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder withSession(McpStreamableSession session) {
			this.session = session;
			return this;
		}

		/**
		 * @param maxBodyBytes largest accepted request body
		 * @return this builder
		 */
		public Builder withMaxBodyBytes(int maxBodyBytes) {
			if (maxBodyBytes <= 0 || maxBodyBytes == Integer.MAX_VALUE) {
				throw new IllegalArgumentException("maxBodyBytes must be positive and below Integer.MAX_VALUE");
			}
			this.maxBodyBytes = maxBodyBytes;
			return this;
		}

		/**
		 * @param requestTimeout how long a caller waits for its reply; {@code null} or
		 * zero waits until the reply arrives or the session ends
		 * @return this builder
		 */
		public Builder withRequestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public StreamableHttpServerTransportProvider build() {
			if (this.session == null) {
				throw new IllegalStateException("session must be set");
			}
			ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : new ObjectMapper();
			return new StreamableHttpServerTransportProvider(mapper, this.session, this.maxBodyBytes,
					this.requestTimeout);
		}

	}

}
