package com.di.sheetload.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    @Test
    @DisplayName("Should expose request id and path during the request only")
    void testMdcLifecycle() throws Exception {
        AtomicReference<String> requestId = new AtomicReference<>();
        AtomicReference<String> requestPath = new AtomicReference<>();

        new MdcRequestFilter().doFilter(new MockHttpServletRequest("POST", "/api/ingest/load"),
                new MockHttpServletResponse(), (request, response) -> {
                    requestId.set(MDC.get(MdcRequestFilter.REQUEST_ID));
                    requestPath.set(MDC.get(MdcRequestFilter.REQUEST_PATH));
                });

        assertTrue(requestId.get().matches("req-[0-9a-f]{8}"));
        assertEquals("/api/ingest/load", requestPath.get());
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }
}
