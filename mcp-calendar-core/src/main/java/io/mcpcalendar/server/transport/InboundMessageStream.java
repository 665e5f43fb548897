/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTransportException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Merges the bodies of independent HTTP calls into the single ordered stream read by
 * the message processor. Messages come out in the order {@link #publish} calls
 * completed.
 * <p>
 * The underlying sink is not safe for concurrent emission; callers serialize
 * {@link #publish} and {@link #finish()} (the owning {@link McpStreamableSession} does
 * so under its lock). The stream has a single subscriber.
 */
public class InboundMessageStream {

	private final String sessionId;

	private final Sinks.Many<McpSchema.JSONRPCMessage> sink = Sinks.many().unicast().onBackpressureBuffer();

	private final AtomicBoolean finished = new AtomicBoolean(false);

	public InboundMessageStream(String sessionId) {
		this.sessionId = sessionId;
	}

	/**
	 * Appends a message to the stream.
	 * @param message the decoded message
	 * @throws McpSessionClosedException after {@link #finish()}
	 */
	public void publish(McpSchema.JSONRPCMessage message) {
		if (this.finished.get()) {
			throw new McpSessionClosedException(this.sessionId);
		}
		Sinks.EmitResult result = this.sink.tryEmitNext(message);
		if (result.isFailure()) {
			throw new McpTransportException("Failed to enqueue inbound message: " + result);
		}
	}

	/**
	 * Marks the stream exhausted. Idempotent.
	 * @return {@code true} if this call finished the stream
	 */
	public boolean finish() {
		if (!this.finished.compareAndSet(false, true)) {
			return false;
		}
		this.sink.tryEmitComplete();
		return true;
	}

	public boolean isFinished() {
		return this.finished.get();
	}

	/**
	 * @return the ordered stream of published messages; completes after
	 * {@link #finish()} once buffered messages have been drained
	 */
	public Flux<McpSchema.JSONRPCMessage> asFlux() {
		return this.sink.asFlux();
	}

}
