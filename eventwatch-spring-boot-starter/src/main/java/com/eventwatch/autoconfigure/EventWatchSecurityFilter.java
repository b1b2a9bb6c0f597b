package com.eventwatch.autoconfigure;

import com.eventwatch.core.Inspection;
import com.eventwatch.core.RequestInspector;
import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.util.LogSanitizer;
import com.eventwatch.module.formscan.FormScanModule;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Hooks EventWatch into the servlet filter chain, after Spring Security so the
 * authenticated user is known.
 *
 * <p>
 * Passive: the request is never blocked or altered, the response is never
 * touched, and whatever the chain throws propagates unchanged. Failures of
 * EventWatch itself are logged and the request proceeds.
 * </p>
 */
public class EventWatchSecurityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(EventWatchSecurityFilter.class);

    private static final Set<String> REDACTED_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

    private final RequestInspector inspector;
    private final EventWatchProperties properties;
    private final ClientIpResolver clientIpResolver;
    private final PrincipalResolver principalResolver;

    public EventWatchSecurityFilter(RequestInspector inspector, EventWatchProperties properties,
            ClientIpResolver clientIpResolver, PrincipalResolver principalResolver) {
        this.inspector = inspector;
        this.properties = properties;
        this.clientIpResolver = clientIpResolver;
        this.principalResolver = principalResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        if (!properties.isEnabled() || properties.isExcludedPath(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }

        HttpServletRequest effectiveRequest = bufferFormBody(request);

        Inspection inspection = null;
        try {
            inspection = inspector.begin(buildRequestContext(effectiveRequest));
            inspection.preCheck();
        } catch (RuntimeException e) {
            log.error("[EventWatch] Inbound inspection error (request not affected): {}", e.getMessage());
        }

        try {
            filterChain.doFilter(effectiveRequest, response);
        } catch (Throwable ex) {
            if (inspection != null) {
                inspection.failed(ex);
            }
            throw ex;
        }

        if (inspection == null) {
            return;
        }
        if (effectiveRequest.isAsyncStarted() && finishWhenAsyncCompletes(effectiveRequest, response, inspection)) {
            return;
        }
        inspection.completed(response.getStatus());
    }

    /**
     * Defers the post-checks of an async request until the container completes
     * it, so the status and elapsed time are those of the finished exchange.
     */
    private boolean finishWhenAsyncCompletes(HttpServletRequest request, HttpServletResponse response,
            Inspection inspection) {
        try {
            request.getAsyncContext().addListener(new InspectionAsyncListener(inspection, response));
            return true;
        } catch (RuntimeException e) {
            log.warn("[EventWatch] Could not observe async completion for {}: {}",
                    LogSanitizer.sanitize(request.getRequestURI()), e.getMessage());
            return false;
        }
    }

    /**
     * Wraps state-changing form posts so the body can be scanned and then read
     * again downstream. Bodies declared larger than the limit are left alone.
     */
    private HttpServletRequest bufferFormBody(HttpServletRequest request) {
        if (!properties.isModuleEnabled(FormScanModule.ID)) {
            return request;
        }
        if (!isStateChanging(request.getMethod()) || !isFormEncoded(request.getContentType())) {
            return request;
        }
        int maxBodyBytes = properties.getFormScan().getMaxBodyBytes();
        if (request.getContentLengthLong() > maxBodyBytes) {
            log.debug("[EventWatch] Form body of {} bytes exceeds scan limit, not buffered",
                    request.getContentLengthLong());
            return request;
        }
        try {
            return new CachedBodyHttpServletRequest(request, maxBodyBytes);
        } catch (IOException | RuntimeException e) {
            log.warn("[EventWatch] Could not buffer form body for {}: {}",
                    LogSanitizer.sanitize(request.getRequestURI()), e.getMessage());
            return request;
        }
    }

    private RequestContext buildRequestContext(HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        Enumeration<String> headerNames = request.getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                String lower = name.toLowerCase(Locale.ROOT);
                if (!REDACTED_HEADERS.contains(lower)) {
                    headers.put(lower, request.getHeader(name));
                }
            }
        }

        RequestContext.Builder builder = RequestContext.builder()
                .requestId(UUID.randomUUID().toString().substring(0, 8))
                .method(request.getMethod())
                .path(request.getRequestURI())
                .queryString(request.getQueryString())
                .headers(headers)
                .contentType(request.getContentType())
                .clientIp(clientIpResolver.resolve(request))
                .userAgent(request.getHeader("User-Agent"))
                .userId(principalResolver.resolveUserId(request));

        if (request instanceof CachedBodyHttpServletRequest) {
            CachedBodyHttpServletRequest cached = (CachedBodyHttpServletRequest) request;
            builder.formFields(cached.getFormFields())
                    .bodyBuffered(cached.isFullyBuffered());
        }
        return builder.build();
    }

    private static boolean isStateChanging(String method) {
        if (method == null) {
            return false;
        }
        switch (method.toUpperCase(Locale.ROOT)) {
            case "POST":
            case "PUT":
            case "PATCH":
            case "DELETE":
                return true;
            default:
                return false;
        }
    }

    private static boolean isFormEncoded(String contentType) {
        return contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded");
    }
}
