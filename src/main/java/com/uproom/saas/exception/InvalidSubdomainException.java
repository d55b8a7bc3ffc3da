package com.uproom.saas.exception;

import lombok.Getter;

@Getter
public class InvalidSubdomainException extends RuntimeException {
    private final String subdomain;

    public InvalidSubdomainException(String subdomain, String message) {
        super(message);
        this.subdomain = subdomain;
    }
}
