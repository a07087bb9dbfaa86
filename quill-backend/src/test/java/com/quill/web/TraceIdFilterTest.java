package com.quill.web;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    private String traceIdSeenByChain(MockHttpServletRequest request, MockHttpServletResponse response)
            throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));
            }
        };
        filter.doFilter(request, response, chain);
        return seen.get();
    }

    @Test
    void wellFormedClientIdIsReusedAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/query");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "req-42.a_b");
        MockHttpServletResponse response = new MockHttpServletResponse();

        String seen = traceIdSeenByChain(request, response);

        assertThat(seen).isEqualTo("req-42.a_b");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("req-42.a_b");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void traceIdHeaderIsAcceptedAsFallback() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/tables");
        request.addHeader(TraceIdFilter.ALT_TRACE_ID_HEADER, "upstream-7");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(traceIdSeenByChain(request, response)).isEqualTo("upstream-7");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("upstream-7");
    }

    @Test
    void unsafeOrOversizedIdIsReplaced() throws Exception {
        MockHttpServletRequest injected = new MockHttpServletRequest("GET", "/api/tables");
        injected.addHeader(TraceIdFilter.TRACE_ID_HEADER, "abc\r\nX-Admin: true");
        MockHttpServletResponse first = new MockHttpServletResponse();

        String replaced = traceIdSeenByChain(injected, first);

        assertThat(replaced).startsWith("q-").hasSize(34);
        assertThat(first.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo(replaced);

        MockHttpServletRequest oversized = new MockHttpServletRequest("GET", "/api/tables");
        oversized.addHeader(TraceIdFilter.TRACE_ID_HEADER, "a".repeat(65));

        assertThat(traceIdSeenByChain(oversized, new MockHttpServletResponse())).startsWith("q-");
    }

    @Test
    void missingIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        String generated = traceIdSeenByChain(new MockHttpServletRequest("GET", "/api/tables"), response);

        assertThat(generated).matches("q-[0-9a-f]{32}");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo(generated);
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }
}
