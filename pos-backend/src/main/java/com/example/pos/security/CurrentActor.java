package com.example.pos.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Reads the actor attributes that {@link AuthAttributesFilter} puts on each authenticated
 * request.
 */
public final class CurrentActor {

    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_USERNAME = "username";
    public static final String ATTR_ROLE = "role";
    public static final String ROLE_ADMIN = "ADMIN";

    private CurrentActor() {
    }

    public static String username(HttpServletRequest request) {
        Object value = request.getAttribute(ATTR_USERNAME);
        return value instanceof String s ? s : null;
    }

    public static String role(HttpServletRequest request) {
        Object value = request.getAttribute(ATTR_ROLE);
        return value instanceof String s ? s : null;
    }

    public static boolean isAdmin(HttpServletRequest request) {
        return ROLE_ADMIN.equalsIgnoreCase(role(request));
    }

    /** Admins see every sale (null scope); anyone else only their own. */
    public static String reportScope(HttpServletRequest request) {
        return isAdmin(request) ? null : username(request);
    }
}
