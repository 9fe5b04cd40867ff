package com.krabby.auth.config.validation.annotations;

import com.krabby.auth.config.validation.ConnectionPoolBoundsValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level constraint on {@link com.krabby.auth.config.AppConfiguration.Database}: the minimum
 * number of pooled connections must not exceed the maximum. The violation is reported on {@code
 * minConnections}.
 */
@Documented
@Constraint(validatedBy = ConnectionPoolBoundsValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ConnectionPoolBounds {

    String message() default "must not be greater than max_connections";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
