/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import io.mcpcalendar.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Turns decoded inbound messages into encoded replies.
 * <p>
 * Implementations are driven one message at a time, in publication order, and must emit
 * exactly one reply for each {@link McpSchema.JSONRPCRequest} and nothing for anything
 * else. Replies are paired with callers by position, so a processor must never reorder
 * them.
 */
@FunctionalInterface
public interface McpMessageProcessor {

	/**
	 * @param message the next inbound message
	 * @return the encoded reply, or empty for a notification
	 */
	Mono<String> process(McpSchema.JSONRPCMessage message);

}
