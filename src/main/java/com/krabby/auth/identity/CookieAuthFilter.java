package com.krabby.auth.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * {@link CookieAuthFilter} is a {@link OncePerRequestFilter OncePerRequest} security filter to
 * validate access tokens sent in the {@link SessionPolicy#ACCESS_TOKEN_COOKIE} cookie. If a
 * previous filter set an authentication on the current security context or the request carries no
 * access token cookie, the filter takes no action. It never refreshes credentials; clients do that
 * explicitly through '{@code /v1/auth/refresh}'.
 */
@Component
public class CookieAuthFilter extends OncePerRequestFilter {

    private final AccountService accountService;

    @Autowired
    CookieAuthFilter(@NonNull AccountService accountService) {
        this.accountService = accountService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            performCookieAuthentication(request);
        }

        filterChain.doFilter(request, response);
    }

    private void performCookieAuthentication(@NonNull HttpServletRequest request) {
        if (request.getCookies() == null) {
            return;
        }

        String accessToken = null;
        for (Cookie cookie : request.getCookies()) {
            if (SessionPolicy.ACCESS_TOKEN_COOKIE.equals(cookie.getName())) {
                accessToken = cookie.getValue();
            }
        }

        if (accessToken == null || accessToken.isBlank()) {
            return;
        }

        val context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(accountService.verifyAccessToken(accessToken));
        SecurityContextHolder.setContext(context);
    }
}
