/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTooManyRequestsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link PendingResponseRegistry} that pairs replies with waiters strictly by arrival
 * order: every {@link #deliver(String)} resolves the oldest queued waiter.
 * <p>
 * This is only correct while the message processor handles requests one at a time and
 * answers them in the order they were published. A processor that reorders replies
 * makes this registry hand them to the wrong callers; such a processor needs an
 * implementation that matches on the reply's id instead.
 * <p>
 * A waiter that times out stays in the queue until its reply arrives and is discarded,
 * so the waiters behind it stay aligned with the processor's output.
 */
public class FifoPendingResponseRegistry implements PendingResponseRegistry {

	private static final Logger logger = LoggerFactory.getLogger(FifoPendingResponseRegistry.class);

	/**
	 * Value for {@code maxPending} that disables the cap.
	 */
	public static final int UNBOUNDED = 0;

	private final String sessionId;

	private final Lock lock;

	private final int maxPending;

	private final Deque<PendingResponse> queue = new ArrayDeque<>();

	private long nextSequence;

	private boolean closed;

	public FifoPendingResponseRegistry(String sessionId) {
		this(sessionId, new ReentrantLock(), UNBOUNDED);
	}

	/**
	 * @param sessionId owner, used in errors and logs
	 * @param lock guards the queue; share it with whatever must be atomic with
	 * {@link #register(Object)}
	 * @param maxPending cap on queued waiters, or {@link #UNBOUNDED}
	 */
	public FifoPendingResponseRegistry(String sessionId, Lock lock, int maxPending) {
		if (maxPending < 0) {
			throw new IllegalArgumentException("maxPending must not be negative");
		}
		this.sessionId = sessionId;
		this.lock = lock;
		this.maxPending = maxPending;
	}

	@Override
	public PendingResponse register(Object requestId) {
		this.lock.lock();
		try {
			if (this.closed) {
				throw new McpSessionClosedException(this.sessionId);
			}
			if (this.maxPending != UNBOUNDED && this.queue.size() >= this.maxPending) {
				throw new McpTooManyRequestsException(this.maxPending);
			}
			PendingResponse pending = new PendingResponse(this.nextSequence++, requestId);
			this.queue.addLast(pending);
			return pending;
		}
		finally {
			this.lock.unlock();
		}
	}

	@Override
	public Mono<ResponseOutcome> awaitResolution(PendingResponse pending, Duration timeout) {
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			return pending.outcome();
		}
		return pending.outcome().timeout(timeout, Mono.defer(() -> {
			if (pending.resolve(new ResponseOutcome.TimedOut(timeout))) {
				logger.debug("Request {} in session {} timed out after {}", pending.requestId(), this.sessionId,
						timeout);
			}
			// the reply may have won the race, either way the slot holds the final outcome
			return pending.outcome();
		}));
	}

	@Override
	public void deliver(String replyPayload) {
		PendingResponse head;
		boolean wasClosed;
		this.lock.lock();
		try {
			head = this.queue.pollFirst();
			wasClosed = this.closed;
		}
		finally {
			this.lock.unlock();
		}

		if (head == null) {
			if (wasClosed) {
				logger.debug("Session {} is closed, dropping reply: {}", this.sessionId, replyPayload);
			}
			else {
				logger.warn("Received a reply with no pending request in session {}; "
						+ "the message processor produced more replies than requests. Dropping: {}", this.sessionId,
						replyPayload);
			}
			return;
		}

		if (!head.resolve(new ResponseOutcome.Delivered(replyPayload))) {
			logger.debug("Caller of request {} stopped waiting, dropping its reply", head.requestId());
		}
	}

	@Override
	public int cancelAll(String reason) {
		List<PendingResponse> drained;
		this.lock.lock();
		try {
			this.closed = true;
			drained = new ArrayList<>(this.queue);
			this.queue.clear();
		}
		finally {
			this.lock.unlock();
		}

		int cancelled = 0;
		for (PendingResponse pending : drained) {
			if (pending.resolve(new ResponseOutcome.Cancelled(reason))) {
				cancelled++;
			}
		}
		if (!drained.isEmpty()) {
			logger.debug("Cancelled {} pending request(s) in session {}: {}", cancelled, this.sessionId, reason);
		}
		return cancelled;
	}

	@Override
	public int pendingCount() {
		this.lock.lock();
		try {
			return this.queue.size();
		}
		finally {
			this.lock.unlock();
		}
	}

	@Override
	public boolean isClosed() {
		this.lock.lock();
		try {
			return this.closed;
		}
		finally {
			this.lock.unlock();
		}
	}

}
