package com.phillippitts.tapguard.config.logging;

import com.phillippitts.tapguard.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Tags every log line written while serving a request with the bridge and terminal that sent it.
 *
 * <p>ThreadContext keys:</p>
 * <ul>
 *   <li>requestId: X-Request-ID header, or a generated UUID; echoed on the response</li>
 *   <li>terminalId: X-Terminal-ID header of the pushing bridge, if present</li>
 *   <li>bridgeId: X-Bridge-ID header naming the bridge instance, if present</li>
 *   <li>endpoint: the kind of call ({@code signal-push}, {@code recovery-status},
 *       {@code recovery-cycle}, {@code actuator} or {@code other})</li>
 * </ul>
 *
 * <p>Header values come from the bridge and are truncated before they reach the logs. A cycle
 * requested through the API inherits these keys through the recovery executor's decorator, so
 * its log lines can be traced back to the request. Only the keys set here are removed afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String TERMINAL_ID_HEADER = "X-Terminal-ID";
    static final String BRIDGE_ID_HEADER = "X-Bridge-ID";

    static final String KEY_REQUEST_ID = "requestId";
    static final String KEY_TERMINAL_ID = "terminalId";
    static final String KEY_BRIDGE_ID = "bridgeId";
    static final String KEY_ENDPOINT = "endpoint";

    private static final int MAX_HEADER_LENGTH = 64;
    private static final List<String> KEYS = List.of(KEY_REQUEST_ID, KEY_TERMINAL_ID, KEY_BRIDGE_ID, KEY_ENDPOINT);

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = header(request, REQUEST_ID_HEADER);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        try {
            ThreadContext.put(KEY_REQUEST_ID, requestId);
            putIfPresent(KEY_TERMINAL_ID, header(request, TERMINAL_ID_HEADER));
            putIfPresent(KEY_BRIDGE_ID, header(request, BRIDGE_ID_HEADER));
            ThreadContext.put(KEY_ENDPOINT, endpointKind(request.getMethod(), request.getRequestURI()));
            response.setHeader(REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(KEYS);
        }
    }

    static String endpointKind(String method, String uri) {
        if (uri == null) {
            return "other";
        }
        if (uri.startsWith("/actuator")) {
            return "actuator";
        }
        if ("POST".equals(method) && uri.equals("/api/v1/terminal/signals")) {
            return "signal-push";
        }
        if ("GET".equals(method) && uri.equals("/api/v1/recovery/status")) {
            return "recovery-status";
        }
        if ("POST".equals(method) && uri.equals("/api/v1/recovery/cycle")) {
            return "recovery-cycle";
        }
        return "other";
    }

    private static String header(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return LogSanitizer.truncate(value.strip(), MAX_HEADER_LENGTH);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            ThreadContext.put(key, value);
        }
    }
}
