package com.phillippitts.tapguard.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcFilterTest {

    private MdcFilter filter;
    private MockHttpServletResponse response;
    private Map<String, String> seen;
    private FilterChain recordingChain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        response = new MockHttpServletResponse();
        seen = new HashMap<>();
        recordingChain = (req, res) -> seen.putAll(ThreadContext.getImmutableContext());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void signalPushIsTaggedWithBridgeAndTerminal() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/terminal/signals");
        request.addHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
        request.addHeader(MdcFilter.TERMINAL_ID_HEADER, "tmr_kiosk_7");
        request.addHeader(MdcFilter.BRIDGE_ID_HEADER, "bridge-east-2");

        filter.doFilter(request, response, recordingChain);

        assertThat(seen)
                .containsEntry("requestId", "req-123")
                .containsEntry("terminalId", "tmr_kiosk_7")
                .containsEntry("bridgeId", "bridge-east-2")
                .containsEntry("endpoint", "signal-push");
        assertThat(response.getHeader(MdcFilter.REQUEST_ID_HEADER)).isEqualTo("req-123");
    }

    @Test
    void generatesRequestIdWhenHeaderIsBlank() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/recovery/status");
        request.addHeader(MdcFilter.REQUEST_ID_HEADER, "   ");

        filter.doFilter(request, response, recordingChain);

        assertThat(seen.get("requestId"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(response.getHeader(MdcFilter.REQUEST_ID_HEADER)).isEqualTo(seen.get("requestId"));
        assertThat(seen).containsEntry("endpoint", "recovery-status")
                .doesNotContainKeys("terminalId", "bridgeId");
    }

    @Test
    void truncatesOversizedBridgeHeaders() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/terminal/signals");
        request.addHeader(MdcFilter.TERMINAL_ID_HEADER, "t".repeat(500));

        filter.doFilter(request, response, recordingChain);

        assertThat(seen.get("terminalId")).hasSize(64);
    }

    @Test
    void classifiesEndpoints() {
        assertThat(MdcFilter.endpointKind("POST", "/api/v1/terminal/signals")).isEqualTo("signal-push");
        assertThat(MdcFilter.endpointKind("GET", "/api/v1/recovery/status")).isEqualTo("recovery-status");
        assertThat(MdcFilter.endpointKind("POST", "/api/v1/recovery/cycle")).isEqualTo("recovery-cycle");
        assertThat(MdcFilter.endpointKind("GET", "/actuator/health")).isEqualTo("actuator");
        assertThat(MdcFilter.endpointKind("GET", "/api/v1/terminal/signals")).isEqualTo("other");
        assertThat(MdcFilter.endpointKind("GET", null)).isEqualTo("other");
    }

    @Test
    void removesOnlyItsOwnKeysEvenWhenChainThrows() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/recovery/cycle");
        request.addHeader(MdcFilter.TERMINAL_ID_HEADER, "tmr_kiosk_7");
        ThreadContext.put("cycleId", "9");
        FilterChain failing = (req, res) -> {
            throw new ServletException("Test exception");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("terminalId")).isNull();
        assertThat(ThreadContext.get("endpoint")).isNull();
        assertThat(ThreadContext.get("cycleId")).isEqualTo("9");
    }
}
