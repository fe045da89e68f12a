package com.agora.forum.security;

import com.agora.forum.exception.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authenticates requests that carry {@code Authorization: Bearer <token>}.
 *
 * Requests without a token pass through anonymously; the security rules
 * decide whether the route needs authentication. A bad token also passes
 * through unauthenticated, with the reason stored as a request attribute so
 * the entry point can report "Token expired" rather than a bare 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = "forum.auth.error";

    private static final String BEARER_PREFIX = "Bearer";

    private final TokenIssuer tokenIssuer;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            chain.doFilter(request, response);
            return;
        }

        try {
            SessionClaims claims = tokenIssuer.verify(token);
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(claims.getUserId(), null, Collections.emptyList());
            authentication.setDetails(claims);
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (AuthException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            SecurityContextHolder.clearContext();
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getMessage());
        }

        chain.doFilter(request, response);
    }

    /**
     * Accepts "Bearer x" in any letter case, with extra spaces. The scheme
     * must be followed by whitespace.
     */
    static String extractBearerToken(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.length() <= BEARER_PREFIX.length()
                || !value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                || !Character.isWhitespace(value.charAt(BEARER_PREFIX.length()))) {
            return null;
        }
        String rest = value.substring(BEARER_PREFIX.length()).trim();
        return rest.isEmpty() ? null : rest;
    }
}
