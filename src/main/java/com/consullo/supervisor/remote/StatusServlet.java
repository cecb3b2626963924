package com.consullo.supervisor.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves {@code GET /health} and {@code GET /terminals} as JSON.
 */
final class StatusServlet extends HttpServlet {

  private static final long serialVersionUID = 1L;

  private final transient RemoteTerminalService service;
  private final transient ObjectMapper mapper;

  StatusServlet(final RemoteTerminalService service, final ObjectMapper mapper) {
    this.service = service;
    this.mapper = mapper;
  }

  @Override
  protected void doGet(final HttpServletRequest request, final HttpServletResponse response) throws IOException {
    final Map<String, Object> body = new LinkedHashMap<>();
    switch (request.getServletPath()) {
      case "/health":
        body.put("status", "healthy");
        body.put("sessionsActive", this.service.sessionCount());
        body.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        body.put("timestamp", Instant.now().toString());
        break;
      case "/terminals":
        body.put("sessions", this.service.describeAll());
        break;
      default:
        response.sendError(HttpServletResponse.SC_NOT_FOUND);
        return;
    }
    response.setStatus(HttpServletResponse.SC_OK);
    response.setContentType("application/json");
    response.setCharacterEncoding("UTF-8");
    response.setHeader("Access-Control-Allow-Origin", "*");
    this.mapper.writeValue(response.getOutputStream(), body);
  }
}
