package com.dbbridge.api.validation;

import com.dbbridge.api.model.BackendKind;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Checks a backend id against {@link BackendKind}, listing the supported ids on failure.
 */
public class BackendKindValidator implements ConstraintValidator<ValidBackendKind, String> {

    private boolean allowNull;

    @Override
    public void initialize(ValidBackendKind constraintAnnotation) {
        this.allowNull = constraintAnnotation.allowNull();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return allowNull;
        }

        boolean isValid = BackendKind.isSupported(value);

        if (!isValid) {
            context.disableDefaultConstraintViolation();
            String errorMessage = String.format(
                "Unsupported database type '%s'. Supported types: %s",
                value.replaceAll("[{}$\\\\]", ""), // message templates interpolate these
                BackendKind.ids()
            );
            context.buildConstraintViolationWithTemplate(errorMessage)
                   .addConstraintViolation();
        }

        return isValid;
    }
}
