package com.care.backoffice.auth;

import com.care.backoffice.dto.ErrorResponse;
import com.care.backoffice.repository.StaffUserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects back-office requests without a logged-in session: API calls get a
 * 401 JSON body, page requests are redirected to the login page. A session
 * whose user has since been deleted is invalidated and treated as logged out.
 */
@Component
public class AdminSessionInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminSessionInterceptor.class);

    static final String LOGIN_PAGE = "/login.html";

    private final ObjectMapper objectMapper;
    private final StaffUserRepository userRepository;

    public AdminSessionInterceptor(ObjectMapper objectMapper, StaffUserRepository userRepository) {
        this.objectMapper = objectMapper;
        this.userRepository = userRepository;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        Long userId = AdminSession.currentUserId(request);
        if (userId != null) {
            if (userRepository.existsById(userId)) {
                return true;
            }
            HttpSession session = request.getSession(false);
            if (session != null) {
                session.invalidate();
            }
            log.info("Session of deleted user {} invalidated", userId);
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.startsWith("/admin")) {
            response.sendRedirect(request.getContextPath() + LOGIN_PAGE);
            return false;
        }
        log.debug("Unauthenticated request rejected: {} {}", request.getMethod(), path);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of("Unauthorized"));
        return false;
    }
}
