package com.fueltrack.archival.interceptor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

public class MdcInterceptorTest {

    private final MdcInterceptor interceptor = new MdcInterceptor();

    @AfterEach
    public void tearDown() {
        MDC.clear();
    }

    @Test
    public void testPreHandle_UsesCallerRequestId() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(MdcInterceptor.HEADER_KEY, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(request, response, new Object()));

        assertEquals("req-42", MDC.get(MdcInterceptor.MDC_KEY));
        assertEquals("req-42", response.getHeader(MdcInterceptor.HEADER_KEY));
    }

    @Test
    public void testPreHandle_GeneratesRequestId() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        interceptor.preHandle(new MockHttpServletRequest(), response, new Object());

        String requestId = MDC.get(MdcInterceptor.MDC_KEY);
        assertNotNull(requestId);
        assertEquals(requestId, response.getHeader(MdcInterceptor.HEADER_KEY));
    }

    @Test
    public void testAfterCompletion_ClearsRequestId() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        interceptor.preHandle(request, response, new Object());

        interceptor.afterCompletion(request, response, new Object(), null);

        assertNull(MDC.get(MdcInterceptor.MDC_KEY));
    }
}
