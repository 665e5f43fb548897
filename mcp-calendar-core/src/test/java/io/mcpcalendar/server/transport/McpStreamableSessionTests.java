/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.time.Duration;

import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSessionClosedException;
import io.mcpcalendar.spec.McpTooManyRequestsException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpStreamableSession}.
 */
class McpStreamableSessionTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final McpStreamableSession session = McpStreamableSession.open(FifoPendingResponseRegistry.UNBOUNDED);

	private static McpSchema.JSONRPCRequest request(Object id) {
		return new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, "tools/call", id, null);
	}

	@Test
	void openCreatesDistinctOpenSessions() {
		McpStreamableSession other = McpStreamableSession.open(FifoPendingResponseRegistry.UNBOUNDED);

		assertThat(session.getId()).isNotBlank().isNotEqualTo(other.getId());
		assertThat(session.state()).isEqualTo(McpStreamableSession.State.OPEN);
		assertThat(session.isOpen()).isTrue();
	}

	@Test
	void submitRequestRegistersWaiterAndPublishesMessage() {
		var request = request(1);

		PendingResponse pending = session.submitRequest(request);

		assertThat(pending.requestId()).isEqualTo(1);
		assertThat(session.registry().pendingCount()).isEqualTo(1);
		StepVerifier.create(session.inbound())
			.expectNext(request)
			.then(() -> session.terminate("done"))
			.verifyComplete();
	}

	@Test
	void submitNotificationPublishesWithoutRegistering() {
		var notification = new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_INITIALIZED, null);

		session.submitNotification(notification);

		assertThat(session.registry().pendingCount()).isZero();
		StepVerifier.create(session.inbound())
			.expectNext(notification)
			.then(() -> session.terminate("done"))
			.verifyComplete();
	}

	@Test
	void deliverResolvesWaitersInSubmissionOrder() {
		PendingResponse first = session.submitRequest(request("a"));
		PendingResponse second = session.submitRequest(request("b"));

		session.deliver("reply-a");
		session.deliver("reply-b");

		assertThat(first.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered("reply-a"));
		assertThat(second.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered("reply-b"));
	}

	@Test
	void terminateCancelsPendingWaitersAndClosesSession() {
		PendingResponse first = session.submitRequest(request(1));
		PendingResponse second = session.submitRequest(request(2));

		assertThat(session.terminate("client left")).isTrue();

		assertThat(first.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Cancelled("client left"));
		assertThat(second.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Cancelled("client left"));
		assertThat(session.state()).isEqualTo(McpStreamableSession.State.CLOSED);
		assertThat(session.registry().pendingCount()).isZero();
		assertThat(session.registry().isClosed()).isTrue();
	}

	@Test
	void terminateTwiceIsANoOp() {
		PendingResponse pending = session.submitRequest(request(1));

		assertThat(session.terminate("first")).isTrue();
		assertThat(session.terminate("second")).isFalse();

		assertThat(pending.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Cancelled("first"));
		assertThat(session.state()).isEqualTo(McpStreamableSession.State.CLOSED);
	}

	@Test
	void submissionsAfterTerminationAreRejectedAndNeverPublished() {
		var accepted = request(1);
		session.submitRequest(accepted);
		session.terminate("bye");

		assertThatThrownBy(() -> session.submitRequest(request(2))).isInstanceOf(McpSessionClosedException.class);
		assertThatThrownBy(() -> session.submitNotification(
				new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, "notifications/cancelled", null)))
			.isInstanceOf(McpSessionClosedException.class);

		StepVerifier.create(session.inbound()).expectNext(accepted).verifyComplete();
	}

	@Test
	void closingRejectsSubmissionsBeforeWaitersAreCancelled() {
		PendingResponse pending = session.submitRequest(request(1));

		assertThat(session.beginClose()).isTrue();

		assertThat(session.state()).isEqualTo(McpStreamableSession.State.CLOSING);
		assertThatThrownBy(() -> session.submitRequest(request(2))).isInstanceOf(McpSessionClosedException.class);
		assertThat(pending.isResolved()).isFalse();
		assertThat(session.beginClose()).isFalse();
	}

	@Test
	void finalizeRequiresFinishedStreamAndNoPendingWaiters() {
		session.submitRequest(request(1));
		session.beginClose();

		assertThatThrownBy(session::finalizeClose).isInstanceOf(IllegalStateException.class);

		session.finishInbound();
		assertThatThrownBy(session::finalizeClose).isInstanceOf(IllegalStateException.class);

		session.registry().cancelAll("closing");
		session.finalizeClose();

		assertThat(session.state()).isEqualTo(McpStreamableSession.State.CLOSED);
		assertThatThrownBy(session::finalizeClose).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void finalizeFromOpenIsRejected() {
		assertThatThrownBy(session::finalizeClose).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("OPEN");
	}

	@Test
	void requestRejectedByCapIsNotPublished() {
		McpStreamableSession capped = McpStreamableSession.open(1);
		var first = request(1);
		capped.submitRequest(first);

		assertThatThrownBy(() -> capped.submitRequest(request(2))).isInstanceOf(McpTooManyRequestsException.class);

		StepVerifier.create(capped.inbound())
			.expectNext(first)
			.then(() -> capped.terminate("done"))
			.verifyComplete();
	}

	@Test
	void closeGracefullyTerminates() {
		PendingResponse pending = session.submitRequest(request(1));

		StepVerifier.create(session.closeGracefully()).verifyComplete();

		assertThat(pending.outcome().block(TIMEOUT)).isInstanceOf(ResponseOutcome.Cancelled.class);
		assertThat(session.state()).isEqualTo(McpStreamableSession.State.CLOSED);
	}

}
