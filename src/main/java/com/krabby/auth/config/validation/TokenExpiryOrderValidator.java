package com.krabby.auth.config.validation;

import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.config.validation.annotations.TokenExpiryOrder;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class TokenExpiryOrderValidator implements ConstraintValidator<TokenExpiryOrder, AppConfiguration.Auth> {

    @Override
    public boolean isValid(AppConfiguration.Auth value, ConstraintValidatorContext context) {
        if (value == null || value.getAccessTokenExpiry() == null || value.getRefreshTokenExpiry() == null) {
            return true;
        }

        if (value.getAccessTokenExpiry().isNegative() || value.getRefreshTokenExpiry().isNegative()
            || value.getAccessTokenExpiry().isZero() || value.getRefreshTokenExpiry().isZero()) {
            return true; // reported by @PositiveDuration.
        }

        if (value.getAccessTokenExpiry().getNano() != 0 || value.getRefreshTokenExpiry().getNano() != 0) {
            return true; // reported by @WholeSeconds.
        }

        if (value.getAccessTokenExpiry().getSeconds() < value.getRefreshTokenExpiry().getSeconds()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
            .addPropertyNode("accessTokenExpiry")
            .addConstraintViolation();

        return false;
    }
}
