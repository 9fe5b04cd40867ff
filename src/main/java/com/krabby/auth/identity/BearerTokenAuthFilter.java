package com.krabby.auth.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * <p>
 * A {@link OncePerRequestFilter OncePerRequest} security filter to validate <i>bearer</i> access
 * tokens passed using the <i>Authorization</i> request header. </p>
 * <p>
 * If the Authorization header is missing or doesn't carry a bearer token, the filter leaves the
 * existing {@link org.springframework.security.core.context.SecurityContext SecurityContext}
 * untouched. Otherwise, it sets a new {@link org.springframework.security.core.context.SecurityContext
 * SecurityContext} whose {@link org.springframework.security.core.Authentication Authentication} is
 * non-null only if the token is the current access token of an open session. </p>
 */
@Component
public class BearerTokenAuthFilter extends OncePerRequestFilter {

    private final AccountService accountService;

    @Autowired
    BearerTokenAuthFilter(@NonNull AccountService accountService) {
        this.accountService = accountService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        verifyAuthorizationHeader(request);
        filterChain.doFilter(request, response);
    }

    private void verifyAuthorizationHeader(@NonNull HttpServletRequest request) {
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            return; // a previous filter may have performed authentication.
        }

        val header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.toLowerCase().startsWith("bearer ")) {
            return;
        }

        val context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(accountService.verifyAccessToken(header.substring(7)));
        SecurityContextHolder.setContext(context);
    }
}
