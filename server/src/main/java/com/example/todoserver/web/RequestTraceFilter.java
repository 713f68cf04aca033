package com.example.todoserver.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

@Component
public class RequestTraceFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTraceFilter.class);

    public static final String HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    // client ids end up in log lines, so only short plain tokens are accepted
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final AtomicLong requestCounter = new AtomicLong();
    private final String instancePrefix = "todo-" + Long.toHexString(System.currentTimeMillis()) + "-";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(HEADER));
        long started = System.nanoTime();
        MDC.put(MDC_KEY, traceId);
        response.setHeader(HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            logCompletion(request, response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            MDC.remove(MDC_KEY);
        }
    }

    String resolveTraceId(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return instancePrefix + requestCounter.incrementAndGet();
    }

    private void logCompletion(HttpServletRequest request, int status, long elapsedMillis) {
        if (HttpMethod.GET.matches(request.getMethod())) {
            log.debug("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(), status, elapsedMillis);
        } else {
            log.info("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(), status, elapsedMillis);
        }
    }
}
