package com.uproom.saas.exception;

import lombok.Getter;

import java.util.List;

/**
 * The subdomain belongs to another company, either at check time or when the claim was written.
 */
@Getter
public class SubdomainConflictException extends RuntimeException {
    private final String subdomain;
    private final List<String> alternatives;

    public SubdomainConflictException(String subdomain, List<String> alternatives) {
        this(subdomain, alternatives, null);
    }

    public SubdomainConflictException(String subdomain, List<String> alternatives, Throwable cause) {
        super("Subdomain " + subdomain + " is already taken", cause);
        this.subdomain = subdomain;
        this.alternatives = List.copyOf(alternatives);
    }
}
