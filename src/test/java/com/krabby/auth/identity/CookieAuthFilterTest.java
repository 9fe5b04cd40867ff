package com.krabby.auth.identity;

import jakarta.servlet.http.Cookie;
import lombok.val;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CookieAuthFilterTest {

    @Mock
    private AccountService accountService;

    private CookieAuthFilter filter;

    @BeforeEach
    void setUp() {
        filter = new CookieAuthFilter(accountService);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void doFilter_withValidAccessTokenCookie() throws Exception {
        val authentication = new TestingAuthenticationToken(1L, "valid-token");
        when(accountService.verifyAccessToken("valid-token")).thenReturn(authentication);

        val request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionPolicy.ACCESS_TOKEN_COOKIE, "valid-token"));
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertSame(authentication, SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void doFilter_withInvalidAccessTokenCookie() throws Exception {
        when(accountService.verifyAccessToken("invalid-token")).thenReturn(null);

        val request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionPolicy.ACCESS_TOKEN_COOKIE, "invalid-token"));
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void doFilter_withOnlyRefreshTokenCookie() throws Exception {
        val request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionPolicy.REFRESH_TOKEN_COOKIE, "refresh-token"));
        val response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNull(response.getCookie(SessionPolicy.ACCESS_TOKEN_COOKIE));
        verify(accountService, never()).verifyAccessToken(any());
    }

    @Test
    void doFilter_withExistingAuthentication() throws Exception {
        val existing = new TestingAuthenticationToken(2L, "bearer-token");
        SecurityContextHolder.getContext().setAuthentication(existing);

        val request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionPolicy.ACCESS_TOKEN_COOKIE, "valid-token"));
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertSame(existing, SecurityContextHolder.getContext().getAuthentication());
        verify(accountService, never()).verifyAccessToken(any());
    }
}
