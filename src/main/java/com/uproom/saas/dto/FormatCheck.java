package com.uproom.saas.dto;

/**
 * Outcome of the format rules alone. Never touches the record store.
 */
public class FormatCheck {
    public final boolean isValid;
    public final String message;

    private FormatCheck(boolean isValid, String message) {
        this.isValid = isValid;
        this.message = message;
    }

    public static FormatCheck valid() {
        return new FormatCheck(true, "Valid subdomain format");
    }

    public static FormatCheck invalid(String message) {
        return new FormatCheck(false, message);
    }

    @Override
    public String toString() {
        return "FormatCheck{isValid=" + isValid + ", message='" + message + "'}";
    }
}
