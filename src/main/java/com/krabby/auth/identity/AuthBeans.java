package com.krabby.auth.identity;

import lombok.NonNull;
import lombok.val;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Spring Beans used by various auth components in the identity package.
 */
@Configuration
class AuthBeans {

    static final String PASSWORD_HASHING_EXECUTOR = "passwordHashingExecutor";

    /**
     * Prevents Spring Web from automatically adding the auth filter bean to its filter chain
     * because it has to be added to Spring Security's filter chain and not Spring Web's.
     */
    @NonNull
    @Bean
    public FilterRegistrationBean<BearerTokenAuthFilter> bearerTokenAuthFilterRegistration(BearerTokenAuthFilter filter) {
        val registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    /**
     * Prevents Spring Web from automatically adding the auth filter bean to its filter chain
     * because it has to be added to Spring Security's filter chain and not Spring Web's.
     */
    @NonNull
    @Bean
    public FilterRegistrationBean<CookieAuthFilter> cookieAuthFilterRegistration(CookieAuthFilter filter) {
        val registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    /**
     * Bounded pool for password hashing, sized to the number of processors.
     */
    @NonNull
    @Bean(PASSWORD_HASHING_EXECUTOR)
    public ThreadPoolTaskExecutor passwordHashingExecutor() {
        val processors = Runtime.getRuntime().availableProcessors();
        val executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processors);
        executor.setMaxPoolSize(processors);
        executor.setQueueCapacity(256); // an arbitrary upper-limit for sanity.
        executor.setThreadNamePrefix("password-hashing-");
        return executor;
    }
}
