package com.dbbridge.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.*;

/**
 * Validates that a value names one of the supported backends (mysql, postgresql, sqlite).
 */
@Documented
@Constraint(validatedBy = BackendKindValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidBackendKind {

    String message() default "Unsupported database type";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    /**
     * Whether null values should be considered valid
     */
    boolean allowNull() default true;
}
