package com.care.backoffice.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/** Session attribute names for a logged-in back-office user. */
public final class AdminSession {

    public static final String USER_ID = "backoffice.userId";
    public static final String ROLE = "backoffice.role";

    private AdminSession() {
    }

    public static Long currentUserId(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) return null;
        Object id = session.getAttribute(USER_ID);
        return id instanceof Long l ? l : null;
    }
}
