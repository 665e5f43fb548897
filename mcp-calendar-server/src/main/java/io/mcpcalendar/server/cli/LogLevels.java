/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.cli;

import java.util.Locale;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

final class LogLevels {

	private LogLevels() {
	}

	/**
	 * Maps a level name to Logback. {@code notice} is folded into {@code INFO},
	 * {@code warning} into {@code WARN} and {@code critical} into {@code ERROR}. Unknown
	 * names fall back to {@code INFO}.
	 */
	static Level parse(String name) {
		if (name == null) {
			return Level.INFO;
		}
		return switch (name.toLowerCase(Locale.ROOT)) {
			case "trace" -> Level.TRACE;
			case "debug" -> Level.DEBUG;
			case "warn", "warning" -> Level.WARN;
			case "error", "critical" -> Level.ERROR;
			default -> Level.INFO;
		};
	}

	static void applyToRoot(Level level) {
		Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		root.setLevel(level);
	}

}
