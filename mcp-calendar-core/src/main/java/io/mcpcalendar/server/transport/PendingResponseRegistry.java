/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.time.Duration;

import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTooManyRequestsException;
import reactor.core.publisher.Mono;

/**
 * Pairs each reply emitted by the message processor with the caller waiting for it.
 * <p>
 * Callers only see {@link #register(Object)}, {@link #deliver(String)} and
 * {@link #cancelAll(String)}; how a reply is matched to a waiter (arrival order, or
 * correlation id) is an implementation detail.
 *
 * @see FifoPendingResponseRegistry
 */
public interface PendingResponseRegistry {

	/**
	 * Allocates a waiter for a request that is about to be published.
	 * @param requestId the correlation id carried by the request
	 * @return the waiter handle
	 * @throws McpSessionClosedException once {@link #cancelAll(String)} has been called
	 * @throws McpTooManyRequestsException when the pending cap has been reached
	 */
	PendingResponse register(Object requestId);

	/**
	 * Suspends until the waiter is resolved. Never blocks a thread.
	 * @param pending the waiter returned by {@link #register(Object)}
	 * @return the outcome
	 */
	default Mono<ResponseOutcome> awaitResolution(PendingResponse pending) {
		return pending.outcome();
	}

	/**
	 * Like {@link #awaitResolution(PendingResponse)}, but gives up after
	 * {@code timeout}. Giving up resolves only this waiter.
	 * @param pending the waiter returned by {@link #register(Object)}
	 * @param timeout how long to wait; {@code null} waits indefinitely
	 * @return the outcome
	 */
	Mono<ResponseOutcome> awaitResolution(PendingResponse pending, Duration timeout);

	/**
	 * Hands a reply produced by the message processor to its waiter.
	 * @param replyPayload the encoded reply
	 */
	void deliver(String replyPayload);

	/**
	 * Resolves every outstanding waiter as cancelled and rejects future registrations.
	 * @param reason carried by each {@link ResponseOutcome.Cancelled}
	 * @return how many waiters were cancelled by this call
	 */
	int cancelAll(String reason);

	/**
	 * @return number of waiters still queued, including abandoned ones awaiting their
	 * late reply
	 */
	int pendingCount();

	boolean isClosed();

}
