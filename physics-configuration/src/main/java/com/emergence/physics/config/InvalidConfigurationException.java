package com.emergence.physics.config;

import com.emergence.physics.validation.ValidationResult;

/**
 * Thrown when the configuration document cannot be read or fails schema validation.
 * Fatal to startup: no engine is created from a rejected document.
 */
public final class InvalidConfigurationException extends RuntimeException {

    private final ValidationResult validationResult;

    public InvalidConfigurationException(ValidationResult validationResult) {
        super(validationResult != null ? String.join("; ", validationResult.getErrors()) : "Configuration validation failed");
        this.validationResult = validationResult;
    }

    public InvalidConfigurationException(ValidationResult validationResult, Throwable cause) {
        super(validationResult != null ? String.join("; ", validationResult.getErrors()) : "Configuration validation failed", cause);
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
