package com.shlawgathon.sentientloop.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates agents and monitored modules by the X-Agent-Api-Key header.
 * Only applies to /internal/** endpoints.
 */
@Component
public class AgentApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AgentApiKeyAuthFilter.class);

    public static final String AGENT_API_KEY_HEADER = "X-Agent-Api-Key";

    @Value("${agent.api.key:}")
    private String agentApiKey;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/internal/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        // No key configured: development mode
        if (agentApiKey == null || agentApiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(AGENT_API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + AGENT_API_KEY_HEADER + " header");
            return;
        }

        if (!agentApiKey.equals(providedKey)) {
            log.warn("[API] Rejected internal call to {} with an invalid agent key", request.getRequestURI());
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"status\":401,\"message\":\"" + message + "\"}");
    }
}
