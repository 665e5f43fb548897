/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.time.Duration;

/**
 * How a {@link PendingResponse} was resolved.
 */
public sealed interface ResponseOutcome
		permits ResponseOutcome.Delivered, ResponseOutcome.Cancelled, ResponseOutcome.TimedOut {

	/**
	 * The processor produced the reply for this waiter.
	 * @param payload the encoded JSON-RPC reply
	 */
	record Delivered(String payload) implements ResponseOutcome {
	}

	/**
	 * The session terminated before a reply was produced.
	 * @param reason why the session ended
	 */
	record Cancelled(String reason) implements ResponseOutcome {
	}

	/**
	 * The caller stopped waiting. The waiter keeps its queue position so the late reply
	 * is absorbed by it.
	 * @param timeout the timeout that elapsed
	 */
	record TimedOut(Duration timeout) implements ResponseOutcome {
	}

}
