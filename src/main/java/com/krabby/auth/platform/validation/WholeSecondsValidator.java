package com.krabby.auth.platform.validation;

import com.krabby.auth.platform.validation.annotations.WholeSeconds;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.Duration;

public class WholeSecondsValidator implements ConstraintValidator<WholeSeconds, Duration> {

    @Override
    public boolean isValid(Duration value, ConstraintValidatorContext context) {
        return value == null || value.isNegative() || value.isZero() || value.getNano() == 0;
    }
}
