/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import io.mcpcalendar.spec.AsyncCloseable;
import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One logical conversation between HTTP callers and the message processor. Owns the
 * session id, the {@link State} machine, the {@link PendingResponseRegistry} and the
 * {@link InboundMessageStream}.
 * <p>
 * A single lock guards the state, the registry queue and publication into the inbound
 * stream, so registering a waiter and publishing its request happen as one step with
 * respect to other messages.
 */
public class McpStreamableSession implements AsyncCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpStreamableSession.class);

	public enum State {

		OPEN, CLOSING, CLOSED

	}

	private final String id;

	private final ReentrantLock lock = new ReentrantLock();

	private final PendingResponseRegistry registry;

	private final InboundMessageStream inbound;

	private State state = State.OPEN;

	/**
	 * Creates a session with a fresh random id that correlates replies by arrival order.
	 * @param maxPending cap on requests awaiting a reply, or
	 * {@link FifoPendingResponseRegistry#UNBOUNDED}
	 * @return the open session
	 */
	public static McpStreamableSession open(int maxPending) {
		String id = UUID.randomUUID().toString();
		return new McpStreamableSession(id, lock -> new FifoPendingResponseRegistry(id, lock, maxPending));
	}

	/**
	 * @param id the session id echoed to callers
	 * @param registryFactory builds the registry around the session lock
	 */
	public McpStreamableSession(String id, Function<Lock, PendingResponseRegistry> registryFactory) {
		this.id = id;
		this.registry = registryFactory.apply(this.lock);
		this.inbound = new InboundMessageStream(id);
		logger.info("Opened session {}", id);
	}

	public String getId() {
		return this.id;
	}

	public State state() {
		this.lock.lock();
		try {
			return this.state;
		}
		finally {
			this.lock.unlock();
		}
	}

	public boolean isOpen() {
		return state() == State.OPEN;
	}

	public PendingResponseRegistry registry() {
		return this.registry;
	}

	/**
	 * @return the ordered stream of accepted messages, for the single consumer that
	 * drives the message processor
	 */
	public Flux<McpSchema.JSONRPCMessage> inbound() {
		return this.inbound.asFlux();
	}

	/**
	 * Registers a waiter for the request and publishes it, atomically with respect to
	 * every other submission.
	 * @param request a message carrying a correlation id
	 * @return the waiter to await
	 * @throws McpSessionClosedException if the session is closing or closed; nothing was
	 * published
	 */
	public PendingResponse submitRequest(McpSchema.JSONRPCRequest request) {
		PendingResponse pending;
		this.lock.lock();
		try {
			requireOpen();
			pending = this.registry.register(request.id());
			try {
				this.inbound.publish(request);
			}
			catch (McpTransportException e) {
				// the waiter is queued but nothing will ever answer it
				terminate("Inbound stream rejected request " + request.id());
				throw e;
			}
		}
		finally {
			this.lock.unlock();
		}
		return pending;
	}

	/**
	 * Publishes a message that expects no reply.
	 * @param message a notification, or a response sent by the caller
	 * @throws McpSessionClosedException if the session is closing or closed
	 */
	public void submitNotification(McpSchema.JSONRPCMessage message) {
		this.lock.lock();
		try {
			requireOpen();
			this.inbound.publish(message);
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Hands a reply from the message processor to the waiter it belongs to.
	 * @param replyPayload the encoded reply
	 */
	public void deliver(String replyPayload) {
		this.registry.deliver(replyPayload);
	}

	/**
	 * {@code OPEN -> CLOSING}. From then on registrations and publications are rejected.
	 * @return {@code false} if the session was not open
	 */
	public boolean beginClose() {
		this.lock.lock();
		try {
			if (this.state != State.OPEN) {
				return false;
			}
			this.state = State.CLOSING;
			logger.info("Closing session {}", this.id);
			return true;
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Marks the inbound stream exhausted. The message processor drains what was already
	 * published and then sees the stream complete.
	 */
	public void finishInbound() {
		this.lock.lock();
		try {
			this.inbound.finish();
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * {@code CLOSING -> CLOSED}. Terminal.
	 * @throws IllegalStateException unless the session is closing, the inbound stream is
	 * finished and no waiter is pending
	 */
	public void finalizeClose() {
		this.lock.lock();
		try {
			if (this.state != State.CLOSING) {
				throw new IllegalStateException("Session " + this.id + " cannot be finalized from " + this.state);
			}
			if (!this.inbound.isFinished() || this.registry.pendingCount() != 0) {
				throw new IllegalStateException("Session " + this.id + " still has pending work");
			}
			this.state = State.CLOSED;
			logger.info("Session {} closed", this.id);
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Runs the whole termination sequence: begin closing, finish the inbound stream,
	 * cancel every pending waiter, finalize. A no-op if termination already started.
	 * @param reason carried to every cancelled waiter
	 * @return {@code true} if this call terminated the session
	 */
	public boolean terminate(String reason) {
		if (!beginClose()) {
			return false;
		}
		finishInbound();
		this.registry.cancelAll(reason);
		finalizeClose();
		return true;
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> terminate("Server shutting down"));
	}

	private void requireOpen() {
		if (this.state != State.OPEN) {
			throw new McpSessionClosedException(this.id);
		}
	}

}
