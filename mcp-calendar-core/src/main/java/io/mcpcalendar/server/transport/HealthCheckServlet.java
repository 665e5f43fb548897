/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server.transport;

import java.io.IOException;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Liveness probe. Always answers {@code 200 OK} with a fixed plain-text body.
 */
public class HealthCheckServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	public static final String DEFAULT_HEALTH_ENDPOINT = "/health";

	static final String BODY = "OK";

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		resp.setStatus(HttpServletResponse.SC_OK);
		resp.setContentType("text/plain");
		resp.setCharacterEncoding(StreamableHttpServerTransportProvider.UTF_8);
		resp.getWriter().write(BODY);
	}

}
