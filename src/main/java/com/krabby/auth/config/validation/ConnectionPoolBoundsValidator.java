package com.krabby.auth.config.validation;

import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.config.validation.annotations.ConnectionPoolBounds;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class ConnectionPoolBoundsValidator implements ConstraintValidator<ConnectionPoolBounds, AppConfiguration.Database> {

    @Override
    public boolean isValid(AppConfiguration.Database value, ConstraintValidatorContext context) {
        if (value == null || value.getMinConnections() == null || value.getMaxConnections() == null) {
            return true; // field level constraints report missing values.
        }

        if (value.getMinConnections() <= 0 || value.getMaxConnections() <= 0) {
            return true; // and non-positive ones.
        }

        if (value.getMinConnections() <= value.getMaxConnections()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
            .addPropertyNode("minConnections")
            .addConstraintViolation();

        return false;
    }
}
