package com.phillippitts.frontdesk.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags log lines written while serving carrier webhooks and the session API with the call they
 * concern.
 *
 * <p>{@code requestId} comes from {@code X-Request-ID} (generated when absent) and is echoed on the
 * response. {@code callSid} is taken from the carrier's form parameter and {@code sessionId} from
 * {@code /api/sessions/{id}} paths. Keys are scoped to the request: values that were already in the
 * thread context are restored afterwards, so pipeline keys set by the caller survive.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CallContextFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String CALL_SID_PARAM = "CallSid";
    private static final Pattern SESSION_PATH = Pattern.compile("^/api/sessions/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Map<String, String> context = callContext(request);
        response.setHeader(REQUEST_ID_HEADER, context.get("requestId"));
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(context)) {
            chain.doFilter(request, response);
        }
    }

    static Map<String, String> callContext(HttpServletRequest request) {
        Map<String, String> context = new LinkedHashMap<>();
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        context.put("requestId", StringUtils.hasText(requestId) ? requestId : UUID.randomUUID().toString());

        String callSid = request.getParameter(CALL_SID_PARAM);
        if (StringUtils.hasText(callSid)) {
            context.put("callSid", callSid);
        }
        String uri = request.getRequestURI();
        Matcher session = SESSION_PATH.matcher(uri == null ? "" : uri);
        if (session.find()) {
            context.put("sessionId", session.group(1));
        }
        context.put("route", request.getMethod() + " " + uri);
        return context;
    }
}
