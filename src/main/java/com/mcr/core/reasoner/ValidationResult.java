package com.mcr.core.reasoner;

import java.io.Serializable;

public record ValidationResult(boolean valid, String error) implements Serializable {

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }
}
