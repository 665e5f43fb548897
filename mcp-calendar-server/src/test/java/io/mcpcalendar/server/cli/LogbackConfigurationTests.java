/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the runtime {@code logback.xml} shipped with the server.
 */
class LogbackConfigurationTests {

	@Test
	void logsOnlyToStderrAndConfiguresNoJuliLoggers() throws Exception {
		LoggerContext context = new LoggerContext();
		try {
			JoranConfigurator configurator = new JoranConfigurator();
			configurator.setContext(context);
			configurator.doConfigure(getClass().getResource("/logback.xml"));

			Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
			ConsoleAppender<ILoggingEvent> appender = (ConsoleAppender<ILoggingEvent>) root.getAppender("STDERR");
			assertThat(appender).isNotNull();
			assertThat(appender.getTarget()).isEqualTo("System.err");
			assertThat(context.getLoggerList()).filteredOn(logger -> logger.getName().startsWith("org.apache"))
				.allSatisfy(logger -> assertThat(logger.getLevel()).isNull());
		}
		finally {
			context.stop();
		}
	}

}
