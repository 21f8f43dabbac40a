package com.care.backoffice.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Permissive CORS for the endpoints the public website and patient portal call.
 * Headers are written before the handler runs so error responses carry them too;
 * preflight requests are answered here with 204.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class PublicCorsFilter extends OncePerRequestFilter {

    static final String PUBLIC_BOOKING_PATH = "/api/public/";
    static final String PATIENT_AUTH_PATH = "/api/patient-auth/";

    private final BackofficeProperties properties;

    public PublicCorsFilter(BackofficeProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(PUBLIC_BOOKING_PATH) && !path.startsWith(PATIENT_AUTH_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String origin = path.startsWith(PATIENT_AUTH_PATH)
                ? properties.cors().portalOrigin()
                : properties.cors().publicBookingOrigin();

        response.setHeader("Access-Control-Allow-Origin", origin);
        response.setHeader("Access-Control-Allow-Methods", "POST,OPTIONS");
        response.setHeader("Access-Control-Allow-Headers", "Content-Type,Authorization");

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }
        chain.doFilter(request, response);
    }
}
