package com.dockyard.core.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Requires an admin bearer token for every mutating request under the queue API.
 * Reads (including the SSE stream) stay open.
 */
@Component
@Order(1)
public class AuthFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    static final String ADMIN_PREFIX = "/api/v1/queue";
    private static final String BEARER = "Bearer ";

    private final AuthProperties authProperties;
    private final JwtTokenService tokenService;

    public AuthFilter(AuthProperties authProperties, JwtTokenService tokenService) {
        this.authProperties = authProperties;
        this.tokenService = tokenService;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (!authProperties.isEnabled() || !requiresAdmin(httpRequest)) {
            chain.doFilter(request, response);
            return;
        }

        String header = httpRequest.getHeader("Authorization");
        if (header != null && header.startsWith(BEARER)
                && tokenService.isAdmin(header.substring(BEARER.length()).trim())) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Rejected unauthenticated {} {}", httpRequest.getMethod(), httpRequest.getRequestURI());
        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType("application/json");
        httpResponse.getWriter().write("{\"error\":\"Admin token required\"}");
    }

    private boolean requiresAdmin(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (!path.equals(ADMIN_PREFIX) && !path.startsWith(ADMIN_PREFIX + "/")) {
            return false;
        }
        String method = request.getMethod();
        return !"GET".equals(method) && !"HEAD".equals(method) && !"OPTIONS".equals(method);
    }
}
