package com.krabby.auth;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.identity.BearerTokenAuthFilter;
import com.krabby.auth.identity.CookieAuthFilter;
import com.krabby.auth.identity.SessionPolicy;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.firewall.HttpStatusRequestRejectedHandler;
import org.springframework.security.web.firewall.RequestRejectedHandler;
import org.springframework.stereotype.Component;

// exclude user details service from Spring security. We're not using it.
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        return builder -> {
            builder.featuresToEnable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            builder.featuresToDisable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS);
        };
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull AppConfiguration config) {
        return new OpenAPI()
            .info(
                new Info()
                    .title(config.getApp().getName())
                    .version("v1"))
            .components(
                new Components()
                    .addSecuritySchemes("bearer-token", new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT"))
                    .addSecuritySchemes("access-token-cookie", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.COOKIE)
                        .name(SessionPolicy.ACCESS_TOKEN_COOKIE)))
            .addSecurityItem(new SecurityRequirement().addList("bearer-token"))
            .addSecurityItem(new SecurityRequirement().addList("access-token-cookie"));
    }

    @Bean
    SecurityFilterChain securityFilterChain(
        @NonNull HttpSecurity http,
        @NonNull BearerTokenAuthFilter bearerTokenAuthFilter,
        @NonNull CookieAuthFilter cookieAuthFilter
    ) throws Exception {
        // disable default filters.
        http.cors(c -> c.disable())
            .csrf(c -> c.disable())
            .formLogin(c -> c.disable())
            .headers(c -> c.disable())
            .httpBasic(c -> c.disable())
            .jee(c -> c.disable())
            .logout(c -> c.disable())
            .rememberMe(c -> c.disable())
            .requestCache(c -> c.disable())
            .securityContext(c -> c.disable())
            .sessionManagement(c -> c.disable());

        // Always return 401 since we don't have an entrypoint where we can redirect users for
        // authentication. They must manually initiate authentication by invoking relevant endpoints
        // upon receiving a 401 response status.
        http.exceptionHandling(c -> c.authenticationEntryPoint(
            (request, response, authException) -> response.setStatus(HttpServletResponse.SC_UNAUTHORIZED)));

        // use request filter to use SecurityContext for authorizing requests.
        http.authorizeHttpRequests(c -> c
            .requestMatchers(HttpMethod.POST, "/v1/auth/register").permitAll()
            .requestMatchers(HttpMethod.POST, "/v1/auth/login").permitAll()
            .requestMatchers(HttpMethod.POST, "/v1/auth/refresh").permitAll()
            .requestMatchers(HttpMethod.POST, "/v1/auth/logout").permitAll()
            .requestMatchers("/v?*/**").fullyAuthenticated()
            .anyRequest().permitAll());

        // add custom filters to set SecurityContext based on the presented access token.
        http.addFilterBefore(bearerTokenAuthFilter, AnonymousAuthenticationFilter.class);
        http.addFilterBefore(cookieAuthFilter, AnonymousAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    RequestRejectedHandler requestRejectedHandler() {
        return new HttpStatusRequestRejectedHandler();
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private AppConfiguration config;

        @Override
        public void run(ApplicationArguments args) {
            log.info("Running {} in '{}' environment", config.getApp().getName(), config.getApp().getEnvironment());
        }
    }
}
