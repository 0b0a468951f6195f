package com.example.pos.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Copies the authenticated principal onto request attributes ({@code userId},
 * {@code username}, {@code role}) so controllers can attribute sales and pick a reporting scope
 * without touching the security context.
 */
@Component
public class AuthAttributesFilter extends OncePerRequestFilter {

    private static final String ROLE_PREFIX = "ROLE_";
    private static final Logger log = LoggerFactory.getLogger(AuthAttributesFilter.class);

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain)
            throws ServletException, IOException {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getDetails() instanceof Long id) {
            request.setAttribute(CurrentActor.ATTR_USER_ID, id);
            request.setAttribute(CurrentActor.ATTR_USERNAME, auth.getName());
            for (GrantedAuthority authority : auth.getAuthorities()) {
                String name = authority.getAuthority();
                if (name != null && name.startsWith(ROLE_PREFIX)) {
                    request.setAttribute(CurrentActor.ATTR_ROLE, name.substring(ROLE_PREFIX.length()));
                    break;
                }
            }
            log.debug("Request {} attributed to {}", request.getRequestURI(), auth.getName());
        }
        filterChain.doFilter(request, response);
    }
}
