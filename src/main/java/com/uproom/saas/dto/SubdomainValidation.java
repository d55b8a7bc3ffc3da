package com.uproom.saas.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class SubdomainValidation {
    public static final String AVAILABLE = "Subdomain is available";
    public static final String TAKEN = "Subdomain is already taken";

    public final boolean isValid;
    public final boolean isAvailable;
    public final String message;

    public SubdomainValidation(boolean isValid, boolean isAvailable, String message) {
        this.isValid = isValid;
        this.isAvailable = isAvailable;
        this.message = message;
    }

    public static SubdomainValidation rejected(FormatCheck format) {
        return new SubdomainValidation(false, false, format.message);
    }

    public static SubdomainValidation checked(boolean available) {
        return new SubdomainValidation(true, available, available ? AVAILABLE : TAKEN);
    }

    /** True when the name may be offered to a tenant right now. */
    @JsonIgnore
    public boolean isUsable() {
        return isValid && isAvailable;
    }

    @Override
    public String toString() {
        return "SubdomainValidation{isValid=" + isValid + ", isAvailable=" + isAvailable
            + ", message='" + message + "'}";
    }
}
