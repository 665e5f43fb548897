/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.server.transport.McpStreamableSession;
import io.mcpcalendar.spec.AsyncCloseable;
import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * The single sequential consumer of a session's inbound stream. Feeds each message to the
 * {@link McpMessageProcessor} on a dedicated thread and hands every reply back to the
 * session.
 * <p>
 * A request always yields exactly one reply, even when the processor fails or returns
 * nothing, so the session's arrival-order correlation stays aligned.
 */
public class McpMessagePump implements AsyncCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpMessagePump.class);

	private final McpStreamableSession session;

	private final McpMessageProcessor processor;

	private final ObjectMapper objectMapper;

	private final Scheduler scheduler;

	private volatile Disposable subscription;

	public McpMessagePump(McpStreamableSession session, McpMessageProcessor processor, ObjectMapper objectMapper) {
		this.session = session;
		this.processor = processor;
		this.objectMapper = objectMapper;
		this.scheduler = Schedulers.newSingle("mcp-processor-" + session.getId());
	}

	/**
	 * Subscribes to the session's inbound stream. Call once.
	 * @return this pump
	 */
	public McpMessagePump start() {
		if (this.subscription != null) {
			throw new IllegalStateException("Pump for session " + this.session.getId() + " already started");
		}
		this.subscription = this.session.inbound()
			.publishOn(this.scheduler)
			.concatMap(this::processOne)
			.subscribe(this.session::deliver,
					error -> logger.error("Message pump for session {} failed", this.session.getId(), error),
					() -> logger.debug("Inbound stream of session {} finished", this.session.getId()));
		return this;
	}

	private Mono<String> processOne(McpSchema.JSONRPCMessage message) {
		if (message instanceof McpSchema.JSONRPCRequest request) {
			return Mono.defer(() -> this.processor.process(request))
				.onErrorResume(error -> {
					logger.error("Error processing request {} ({})", request.id(), request.method(), error);
					return Mono.just(encodeError(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR,
							"Internal error: " + error.getMessage()));
				})
				.switchIfEmpty(Mono.fromSupplier(() -> {
					logger.warn("Message processor produced no reply for request {} ({})", request.id(),
							request.method());
					return encodeError(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, "No reply produced");
				}));
		}
		return Mono.defer(() -> this.processor.process(message))
			.doOnNext(reply -> logger.warn("Dropping reply produced for a message without id: {}", reply))
			.onErrorResume(error -> {
				logger.error("Error processing message {}", message, error);
				return Mono.empty();
			})
			.then(Mono.<String>empty());
	}

	private String encodeError(Object id, int code, String message) {
		try {
			return this.objectMapper.writeValueAsString(McpSchema.JSONRPCResponse.error(id, code, message));
		}
		catch (JsonProcessingException e) {
			throw new McpTransportException("Failed to encode error reply", e);
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			Disposable current = this.subscription;
			if (current != null && !current.isDisposed()) {
				current.dispose();
			}
			this.scheduler.dispose();
		});
	}

}
