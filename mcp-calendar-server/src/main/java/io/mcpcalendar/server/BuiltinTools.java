/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import io.mcpcalendar.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Tools every server instance offers regardless of the calendar backend.
 */
public final class BuiltinTools {

	public static final String ECHO = "echo";

	public static final String CURRENT_TIME = "current_time";

	private BuiltinTools() {
	}

	public static List<McpServerFeatures.ToolSpecification> all(Clock clock) {
		return List.of(echo(), currentTime(clock));
	}

	/**
	 * Returns the {@code text} argument unchanged.
	 */
	public static McpServerFeatures.ToolSpecification echo() {
		McpSchema.Tool tool = new McpSchema.Tool(ECHO, "Returns the given text unchanged",
				new McpSchema.JsonSchema("object", Map.of("text", Map.of("type", "string")), List.of("text")));
		return new McpServerFeatures.ToolSpecification(tool, request -> Mono.fromSupplier(() -> {
			Object text = request.arguments() != null ? request.arguments().get("text") : null;
			if (!(text instanceof String value)) {
				throw new IllegalArgumentException("Missing required argument: text");
			}
			return McpSchema.CallToolResult.text(value);
		}));
	}

	/**
	 * Formats the current instant as ISO-8601 in the requested {@code timezone}, or in
	 * the clock's zone when none is given.
	 */
	public static McpServerFeatures.ToolSpecification currentTime(Clock clock) {
		McpSchema.Tool tool = new McpSchema.Tool(CURRENT_TIME, "Returns the current date and time in ISO-8601 format",
				new McpSchema.JsonSchema("object", Map.of("timezone", Map.of("type", "string")), null));
		return new McpServerFeatures.ToolSpecification(tool, request -> Mono.fromSupplier(() -> {
			Object timezone = request.arguments() != null ? request.arguments().get("timezone") : null;
			ZoneId zone = timezone != null ? ZoneId.of(timezone.toString()) : clock.getZone();
			return McpSchema.CallToolResult
				.text(ZonedDateTime.now(clock.withZone(zone)).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
		}));
	}

}
