/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.spec.AsyncCloseable;
import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTooManyRequestsException;
import io.mcpcalendar.spec.McpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Serves one {@link McpStreamableSession} over a pair of byte streams, normally the
 * process's stdin and stdout. Each inbound line is one JSON-RPC message; each reply is
 * written as one line.
 * <p>
 * Requests go through the same register-then-publish path as the HTTP endpoint, so
 * replies come back in arrival order. End of input drains the replies still owed,
 * terminates the session and completes {@link #awaitTermination()}.
 */
public class StdioServerTransport implements AsyncCloseable {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransport.class);

	private final ObjectMapper objectMapper;

	private final McpStreamableSession session;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final Duration requestTimeout;

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final Set<Mono<Void>> inFlightWrites = ConcurrentHashMap.newKeySet();

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private final AtomicBoolean started = new AtomicBoolean();

	private final AtomicBoolean isClosing = new AtomicBoolean();

	/**
	 * Creates a transport over the process's standard streams.
	 * @param objectMapper decodes inbound lines and encodes error replies
	 * @param session the session fed by this transport
	 * @param requestTimeout how long a request waits for its reply; {@code null} waits
	 * indefinitely
	 */
	public StdioServerTransport(ObjectMapper objectMapper, McpStreamableSession session, Duration requestTimeout) {
		this(objectMapper, session, System.in, System.out, requestTimeout);
	}

	public StdioServerTransport(ObjectMapper objectMapper, McpStreamableSession session, InputStream inputStream,
			OutputStream outputStream, Duration requestTimeout) {
		if (objectMapper == null || session == null) {
			throw new IllegalArgumentException("objectMapper and session must not be null");
		}
		if (inputStream == null || outputStream == null) {
			throw new IllegalArgumentException("inputStream and outputStream must not be null");
		}
		this.objectMapper = objectMapper;
		this.session = session;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
		this.requestTimeout = requestTimeout;
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "mcp-stdio-inbound");
			thread.setDaemon(true);
			return thread;
		}), "mcp-stdio-inbound");
		this.outboundScheduler = Schedulers.newSingle("mcp-stdio-outbound");
	}

	public McpStreamableSession getSession() {
		return this.session;
	}

	/**
	 * Starts reading the input stream on a dedicated thread. Call once.
	 * @return this transport
	 */
	public StdioServerTransport start() {
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Stdio transport for session " + this.session.getId() + " already started");
		}
		this.inboundScheduler.schedule(this::readLoop);
		logger.info("Serving session {} over stdio", this.session.getId());
		return this;
	}

	/**
	 * @return completes once the input stream ended or the transport was closed, and the
	 * session has terminated
	 */
	public Mono<Void> awaitTermination() {
		return this.terminated.asMono();
	}

	private void readLoop() {
		try {
			BufferedReader reader = new BufferedReader(new InputStreamReader(this.inputStream, StandardCharsets.UTF_8));
			String line;
			while (!this.isClosing.get() && (line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				if (!handleLine(line)) {
					break;
				}
			}
		}
		catch (IOException e) {
			if (!this.isClosing.get()) {
				logger.error("Error reading from input stream", e);
			}
		}
		finally {
			if (!this.isClosing.get()) {
				logger.info("Input stream of session {} ended", this.session.getId());
				drainWrites().block();
				this.session.terminate("Input stream closed");
			}
			this.terminated.tryEmitEmpty();
		}
	}

	/**
	 * @return {@code false} once the session no longer accepts messages
	 */
	private boolean handleLine(String line) {
		final McpSchema.JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, line.getBytes(StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			logger.error("Error processing inbound message: {}", e.getMessage());
			write(encodeError(null, McpSchema.ErrorCodes.PARSE_ERROR, "Parse error"));
			return true;
		}
		catch (IllegalArgumentException e) {
			logger.error("Error processing inbound message: {}", e.getMessage());
			write(encodeError(null, McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid request: " + e.getMessage()));
			return true;
		}

		try {
			if (message instanceof McpSchema.JSONRPCRequest request) {
				handleRequest(request);
			}
			else {
				this.session.submitNotification(message);
			}
			return true;
		}
		catch (McpSessionClosedException e) {
			logger.debug("Session {} closed, no longer reading", this.session.getId());
			return false;
		}
		catch (McpTransportException e) {
			logger.error("Failed to accept inbound message", e);
			return this.session.isOpen();
		}
	}

	private void handleRequest(McpSchema.JSONRPCRequest request) {
		final PendingResponse pending;
		try {
			pending = this.session.submitRequest(request);
		}
		catch (McpTooManyRequestsException e) {
			logger.warn("Rejecting request {}: {}", request.id(), e.getMessage());
			write(encodeError(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, e.getMessage()));
			return;
		}
		track(this.session.registry()
			.awaitResolution(pending, this.requestTimeout)
			.publishOn(this.outboundScheduler)
			.map(outcome -> render(request, outcome))
			.doOnNext(this::writeLine)
			.then());
	}

	private String render(McpSchema.JSONRPCRequest request, ResponseOutcome outcome) {
		if (outcome instanceof ResponseOutcome.Delivered delivered) {
			return delivered.payload();
		}
		if (outcome instanceof ResponseOutcome.Cancelled cancelled) {
			return encodeError(request.id(), McpSchema.ErrorCodes.CONNECTION_CLOSED,
					"Session terminated: " + cancelled.reason());
		}
		ResponseOutcome.TimedOut timedOut = (ResponseOutcome.TimedOut) outcome;
		return encodeError(request.id(), McpSchema.ErrorCodes.REQUEST_TIMEOUT,
				"Request timed out after " + timedOut.timeout().toMillis() + " ms");
	}

	private void write(String payload) {
		track(Mono.fromRunnable(() -> writeLine(payload)).subscribeOn(this.outboundScheduler).then());
	}

	private void track(Mono<Void> write) {
		Mono<Void> cached = write.onErrorResume(error -> {
			logger.error("Error writing outbound message", error);
			return Mono.empty();
		}).cache();
		this.inFlightWrites.add(cached);
		cached.doFinally(signal -> this.inFlightWrites.remove(cached)).subscribe();
	}

	private Mono<Void> drainWrites() {
		return Mono.defer(() -> Mono.when(List.copyOf(this.inFlightWrites)));
	}

	private void writeLine(String payload) {
		byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
		synchronized (this.outputStream) {
			try {
				this.outputStream.write(bytes);
				this.outputStream.write('\n');
				this.outputStream.flush();
			}
			catch (IOException e) {
				throw new McpTransportException("Failed to write outbound message", e);
			}
		}
	}

	private String encodeError(Object id, int code, String message) {
		try {
			return this.objectMapper.writeValueAsString(McpSchema.JSONRPCResponse.error(id, code, message));
		}
		catch (JsonProcessingException e) {
			throw new McpTransportException("Failed to encode error reply", e);
		}
	}

	/**
	 * Terminates the session, flushes the replies it produced for cancelled waiters and
	 * stops both worker threads. Idempotent.
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.isClosing.compareAndSet(false, true)) {
				return Mono.empty();
			}
			logger.debug("Closing stdio transport of session {}", this.session.getId());
			this.session.terminate("Server shutting down");
			return drainWrites().doFinally(signal -> {
				this.terminated.tryEmitEmpty();
				this.inboundScheduler.dispose();
				this.outboundScheduler.dispose();
			});
		});
	}

}
