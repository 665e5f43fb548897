/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A caller blocked on a reply. Created and resolved by a {@link PendingResponseRegistry};
 * the HTTP handler only ever observes {@link #outcome()}.
 * <p>
 * The completion slot is single-shot: the first {@link #resolve(ResponseOutcome)} wins
 * and every later attempt returns {@code false} without emitting.
 */
public final class PendingResponse {

	private final long sequence;

	private final Object requestId;

	private final AtomicBoolean resolved = new AtomicBoolean(false);

	private final Sinks.One<ResponseOutcome> slot = Sinks.one();

	PendingResponse(long sequence, Object requestId) {
		this.sequence = sequence;
		this.requestId = requestId;
	}

	/**
	 * @return arrival order within the registry, starting at zero
	 */
	public long sequence() {
		return this.sequence;
	}

	/**
	 * @return the correlation id of the request this waiter belongs to
	 */
	public Object requestId() {
		return this.requestId;
	}

	public boolean isResolved() {
		return this.resolved.get();
	}

	/**
	 * Completes with the outcome once it is known. Cached, so late subscribers see it as
	 * well.
	 * @return the outcome of this waiter
	 */
	public Mono<ResponseOutcome> outcome() {
		return this.slot.asMono();
	}

	boolean resolve(ResponseOutcome outcome) {
		if (!this.resolved.compareAndSet(false, true)) {
			return false;
		}
		Sinks.EmitResult result = this.slot.tryEmitValue(outcome);
		if (result.isFailure()) {
			throw new IllegalStateException(
					"Completion slot for request " + this.requestId + " rejected its only value: " + result);
		}
		return true;
	}

	@Override
	public String toString() {
		return "PendingResponse[sequence=" + this.sequence + ", requestId=" + this.requestId + "]";
	}

}
