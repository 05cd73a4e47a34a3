package com.qrwallet.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Turns the caller identity asserted by the fronting identity layer into a Spring Security principal.
 *
 * <p>The identity layer verifies the user's token and forwards the user id in {@value #USER_HEADER};
 * this service must only be reachable through it.
 */
public class CallerAuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_HEADER = "X-User-Id";

    private static final int MAX_USER_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String userId = request.getHeader(USER_HEADER);

        if (StringUtils.hasText(userId) && userId.length() <= MAX_USER_ID_LENGTH
                && SecurityContextHolder.getContext().getAuthentication() == null) {
            PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
                    userId.trim(), null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        chain.doFilter(request, response);
    }
}
