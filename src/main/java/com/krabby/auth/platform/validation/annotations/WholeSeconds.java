package com.krabby.auth.platform.validation.annotations;

import com.krabby.auth.platform.validation.WholeSecondsValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated positive {@link java.time.Duration} must be a whole number of seconds. {@literal
 * null}, zero and negative durations are valid, use {@link PositiveDuration} to reject those.
 */
@Documented
@Constraint(validatedBy = WholeSecondsValidator.class)
@Target({ElementType.METHOD, ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface WholeSeconds {

    String message() default "must be a whole number of seconds";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
