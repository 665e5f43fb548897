/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.time.Clock;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcalendar.spec.McpError;
import io.mcpcalendar.spec.McpSchema;
import io.mcpcalendar.spec.McpSchema.JSONRPCResponse;
import io.mcpcalendar.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.mcpcalendar.spec.McpTransportException;
import io.mcpcalendar.spec.ProtocolVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * JSON-RPC dispatcher answering the lifecycle and tool methods of MCP.
 * <p>
 * Every request yields exactly one encoded reply; notifications and responses sent by
 * the client yield none.
 */
public class McpServerMessageProcessor implements McpMessageProcessor {

	private static final Logger logger = LoggerFactory.getLogger(McpServerMessageProcessor.class);

	public static final McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation(
			"mcp-macos-calendar", "1.0.0");

	@FunctionalInterface
	interface RequestHandler {

		Mono<?> handle(Object params);

	}

	private final ObjectMapper objectMapper;

	private final ToolsRepository toolsRepository;

	private final McpSchema.Implementation serverInfo;

	private final String instructions;

	private final Map<String, RequestHandler> requestHandlers;

	/**
	 * @param objectMapper encodes the replies
	 * @return a processor serving {@link BuiltinTools} against the system clock
	 */
	public static McpServerMessageProcessor withBuiltinTools(ObjectMapper objectMapper) {
		return new McpServerMessageProcessor(objectMapper,
				new InMemoryToolsRepository(BuiltinTools.all(Clock.systemDefaultZone())));
	}

	public McpServerMessageProcessor(ObjectMapper objectMapper, ToolsRepository toolsRepository) {
		this(objectMapper, toolsRepository, DEFAULT_SERVER_INFO, null);
	}

	public McpServerMessageProcessor(ObjectMapper objectMapper, ToolsRepository toolsRepository,
			McpSchema.Implementation serverInfo, String instructions) {
		this.objectMapper = objectMapper;
		this.toolsRepository = toolsRepository;
		this.serverInfo = serverInfo;
		this.instructions = instructions;
		this.requestHandlers = Map.of(McpSchema.METHOD_INITIALIZE, this::initialize, McpSchema.METHOD_PING,
				params -> Mono.just(Map.of()), McpSchema.METHOD_TOOLS_LIST, this::listTools,
				McpSchema.METHOD_TOOLS_CALL, this::callTool);
	}

	@Override
	public Mono<String> process(McpSchema.JSONRPCMessage message) {
		if (message instanceof McpSchema.JSONRPCRequest request) {
			return handleRequest(request).map(this::encode);
		}
		if (message instanceof McpSchema.JSONRPCNotification notification) {
			handleNotification(notification);
		}
		else {
			logger.debug("Ignoring response sent by client: {}", message);
		}
		return Mono.empty();
	}

	private Mono<JSONRPCResponse> handleRequest(McpSchema.JSONRPCRequest request) {
		RequestHandler handler = request.method() != null ? this.requestHandlers.get(request.method()) : null;
		if (handler == null) {
			return Mono.just(JSONRPCResponse.error(request.id(), McpSchema.ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + request.method()));
		}
		return Mono.defer(() -> handler.handle(request.params()))
			.<JSONRPCResponse>map(result -> JSONRPCResponse.success(request.id(), result))
			.onErrorResume(t -> {
				JSONRPCError error;
				if (t instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
					error = mcpError.getJsonRpcError();
				}
				else {
					logger.error("Request {} ({}) failed", request.id(), request.method(), t);
					error = new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, t.getMessage(), null);
				}
				return Mono.just(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null, error));
			});
	}

	private void handleNotification(McpSchema.JSONRPCNotification notification) {
		if (notification.method() == null) {
			logger.warn("Ignoring notification without method");
			return;
		}
		switch (notification.method()) {
			case McpSchema.METHOD_NOTIFICATION_INITIALIZED -> logger.info("Client initialized");
			case McpSchema.METHOD_NOTIFICATION_CANCELLED ->
				logger.debug("Client cancelled a request: {}", notification.params());
			default -> logger.warn("Missing handler for notification type: {}", notification.method());
		}
	}

	private Mono<McpSchema.InitializeResult> initialize(Object params) {
		McpSchema.InitializeRequest request = convert(params, McpSchema.InitializeRequest.class);
		String requested = request.protocolVersion();
		String negotiated = requested != null && ProtocolVersions.SUPPORTED.contains(requested) ? requested
				: ProtocolVersions.LATEST;
		if (!negotiated.equals(requested)) {
			logger.warn("Client requested unsupported protocol version {}, offering {}", requested, negotiated);
		}
		logger.info("Client initialize request - Protocol: {}, Info: {}", requested, request.clientInfo());
		return Mono.just(new McpSchema.InitializeResult(negotiated,
				new McpSchema.ServerCapabilities(new McpSchema.ServerCapabilities.ToolCapabilities(false)),
				this.serverInfo, this.instructions));
	}

	private Mono<McpSchema.ListToolsResult> listTools(Object params) {
		return this.toolsRepository.listTools().map(tools -> new McpSchema.ListToolsResult(tools, null));
	}

	private Mono<McpSchema.CallToolResult> callTool(Object params) {
		McpSchema.CallToolRequest request = convert(params, McpSchema.CallToolRequest.class);
		return this.toolsRepository.resolveToolForCall(request.name())
			.flatMap(tool -> Mono.defer(() -> tool.callHandler().apply(request))
				.onErrorResume(e -> {
					logger.debug("Tool {} failed: {}", request.name(), e.getMessage());
					return Mono.just(McpSchema.CallToolResult.error("Error: " + e.getMessage()));
				}))
			.switchIfEmpty(Mono.fromSupplier(() -> McpSchema.CallToolResult.error("Unknown tool: " + request.name())));
	}

	private <T> T convert(Object params, Class<T> type) {
		if (params == null) {
			throw McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS).message("Missing params").build();
		}
		try {
			return this.objectMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Invalid params: " + e.getMessage())
				.build();
		}
	}

	private String encode(JSONRPCResponse response) {
		try {
			return this.objectMapper.writeValueAsString(response);
		}
		catch (JsonProcessingException e) {
			throw new McpTransportException("Failed to encode reply to request " + response.id(), e);
		}
	}

}
