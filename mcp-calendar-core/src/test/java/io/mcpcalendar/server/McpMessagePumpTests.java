/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.server.transport.FifoPendingResponseRegistry;
import io.mcpcalendar.server.transport.McpStreamableSession;
import io.mcpcalendar.server.transport.PendingResponse;
import io.mcpcalendar.server.transport.ResponseOutcome;
import io.mcpcalendar.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link McpMessagePump}.
 */
class McpMessagePumpTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final McpStreamableSession session = McpStreamableSession.open(FifoPendingResponseRegistry.UNBOUNDED);

	private McpMessagePump pump;

	@AfterEach
	void tearDown() {
		session.terminate("test finished");
		if (pump != null) {
			pump.closeGracefully().block(TIMEOUT);
		}
	}

	private static McpSchema.JSONRPCRequest request(Object id) {
		return new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, "tools/call", id, null);
	}

	private static String reply(Object id) {
		return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":{}}";
	}

	private Map<String, Object> decode(ResponseOutcome outcome) throws Exception {
		assertThat(outcome).isInstanceOf(ResponseOutcome.Delivered.class);
		return objectMapper.readValue(((ResponseOutcome.Delivered) outcome).payload(), new TypeReference<>() {
		});
	}

	@Test
	void slowFirstReplyIsStillPairedWithFirstRequest() {
		pump = new McpMessagePump(session, message -> {
			McpSchema.JSONRPCRequest request = (McpSchema.JSONRPCRequest) message;
			Duration delay = Integer.valueOf(1).equals(request.id()) ? Duration.ofMillis(200) : Duration.ZERO;
			return Mono.delay(delay).thenReturn(reply(request.id()));
		}, objectMapper).start();

		PendingResponse first = session.submitRequest(request(1));
		PendingResponse second = session.submitRequest(request(2));

		assertThat(first.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(1)));
		assertThat(second.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(2)));
	}

	@Test
	void processesOneMessageAtATime() {
		AtomicInteger inFlight = new AtomicInteger();
		AtomicInteger maxInFlight = new AtomicInteger();
		pump = new McpMessagePump(session, message -> Mono.defer(() -> {
			maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
			return Mono.delay(Duration.ofMillis(10));
		}).doOnTerminate(inFlight::decrementAndGet).thenReturn(reply(((McpSchema.JSONRPCRequest) message).id())),
				objectMapper)
			.start();

		List<PendingResponse> pending = new CopyOnWriteArrayList<>();
		for (int i = 0; i < 10; i++) {
			pending.add(session.submitRequest(request(i)));
		}

		for (int i = 0; i < 10; i++) {
			assertThat(pending.get(i).outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(i)));
		}
		assertThat(maxInFlight.get()).isEqualTo(1);
	}

	@Test
	void processorErrorBecomesInternalErrorReplyForThatRequest() throws Exception {
		pump = new McpMessagePump(session, message -> {
			McpSchema.JSONRPCRequest request = (McpSchema.JSONRPCRequest) message;
			if ("boom".equals(request.id())) {
				return Mono.error(new IllegalStateException("handler exploded"));
			}
			return Mono.just(reply(request.id()));
		}, objectMapper).start();

		PendingResponse failing = session.submitRequest(request("boom"));
		PendingResponse healthy = session.submitRequest(request(7));

		Map<String, Object> error = decode(failing.outcome().block(TIMEOUT));
		assertThat(error).containsEntry("id", "boom").containsKey("error");
		@SuppressWarnings("unchecked")
		Map<String, Object> details = (Map<String, Object>) error.get("error");
		assertThat(details).containsEntry("code", McpSchema.ErrorCodes.INTERNAL_ERROR);
		assertThat((String) details.get("message")).contains("handler exploded");

		assertThat(healthy.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(7)));
	}

	@Test
	void processorThrowingSynchronouslyIsHandledLikeAnError() throws Exception {
		pump = new McpMessagePump(session, message -> {
			throw new IllegalArgumentException("bad input");
		}, objectMapper).start();

		PendingResponse pending = session.submitRequest(request(1));

		assertThat(decode(pending.outcome().block(TIMEOUT))).containsKey("error");
	}

	@Test
	void missingReplyForRequestIsReplacedWithError() throws Exception {
		pump = new McpMessagePump(session, message -> Mono.empty(), objectMapper).start();

		PendingResponse first = session.submitRequest(request(1));

		Map<String, Object> reply = decode(first.outcome().block(TIMEOUT));
		assertThat(reply).containsEntry("id", 1).containsKey("error");
	}

	@Test
	void replyToNotificationIsDropped() {
		List<McpSchema.JSONRPCMessage> seen = new CopyOnWriteArrayList<>();
		pump = new McpMessagePump(session, message -> {
			seen.add(message);
			if (message instanceof McpSchema.JSONRPCRequest request) {
				return Mono.just(reply(request.id()));
			}
			return Mono.just("{\"unexpected\":true}");
		}, objectMapper).start();

		session.submitNotification(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_INITIALIZED, null));
		PendingResponse pending = session.submitRequest(request(3));

		assertThat(pending.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(3)));
		assertThat(seen).hasSize(2);
	}

	@Test
	void notificationErrorDoesNotStopThePump() {
		pump = new McpMessagePump(session, message -> {
			if (message instanceof McpSchema.JSONRPCRequest request) {
				return Mono.just(reply(request.id()));
			}
			return Mono.error(new RuntimeException("notification failed"));
		}, objectMapper).start();

		session.submitNotification(
				new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, "notifications/cancelled", null));
		PendingResponse pending = session.submitRequest(request(4));

		assertThat(pending.outcome().block(TIMEOUT)).isEqualTo(new ResponseOutcome.Delivered(reply(4)));
	}

	@Test
	void pumpDrainsBufferedMessagesAndStopsWhenSessionEnds() {
		List<McpSchema.JSONRPCMessage> seen = new CopyOnWriteArrayList<>();
		pump = new McpMessagePump(session, message -> {
			seen.add(message);
			return Mono.empty();
		}, objectMapper);
		session.submitNotification(
				new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, "notifications/initialized", null));
		session.terminate("bye");

		pump.start();

		await().atMost(TIMEOUT).untilAsserted(() -> assertThat(seen).hasSize(1));
	}

	@Test
	void startingTwiceIsRejected() {
		pump = new McpMessagePump(session, message -> Mono.empty(), objectMapper).start();

		assertThatThrownBy(pump::start).isInstanceOf(IllegalStateException.class);
	}

}
