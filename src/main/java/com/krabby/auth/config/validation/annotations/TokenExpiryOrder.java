package com.krabby.auth.config.validation.annotations;

import com.krabby.auth.config.validation.TokenExpiryOrderValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level constraint on {@link com.krabby.auth.config.AppConfiguration.Auth}: access tokens
 * must expire strictly before refresh tokens. The violation is reported on {@code
 * accessTokenExpiry}.
 */
@Documented
@Constraint(validatedBy = TokenExpiryOrderValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TokenExpiryOrder {

    String message() default "must be shorter than refresh_token_expiry";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
