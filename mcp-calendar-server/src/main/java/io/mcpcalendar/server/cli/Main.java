/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import io.mcpcalendar.server.McpHttpServer;
import io.mcpcalendar.server.McpStdioServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the MCP Calendar Server and blocks until it is shut down.
 */
public class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	public static void main(String[] args) throws Exception {
		ServerCommand command = new ServerCommand();
		JCommander jc = JCommander.newBuilder().programName("mcp-macos-calendar").addObject(command).build();
		try {
			jc.parse(args);
		}
		catch (ParameterException e) {
			System.err.println(e.getMessage());
			jc.usage();
			System.exit(2);
			return;
		}
		if (command.help) {
			jc.usage();
			return;
		}

		LogLevels.applyToRoot(LogLevels.parse(command.logLevel));

		if (command.transport == TransportMode.HTTP) {
			logger.info("Starting MCP Calendar server with HTTP transport on {}:{}", command.host, command.port);
			McpHttpServer server = command.toServerBuilder().build().start();
			Runtime.getRuntime().addShutdownHook(new Thread(server::close, "mcp-shutdown"));
			server.await();
		}
		else {
			logger.info("Starting MCP Calendar server with stdio transport");
			McpStdioServer server = command.toStdioServerBuilder().build().start();
			Runtime.getRuntime().addShutdownHook(new Thread(server::close, "mcp-shutdown"));
			server.await();
			server.close();
		}
	}

}
