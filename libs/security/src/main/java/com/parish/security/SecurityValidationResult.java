package com.parish.security;

import java.util.List;

/**
 * Result of checking a {@link SecurityContext} for shape consistency.
 *
 * @param valid  whether the context passed all checks
 * @param errors error messages (empty if valid)
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }
}
