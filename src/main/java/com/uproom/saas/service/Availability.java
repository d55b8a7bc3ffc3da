package com.uproom.saas.service;

/**
 * What a single record store lookup said about a subdomain.
 */
public enum Availability {
    AVAILABLE,
    TAKEN,
    /** The lookup failed, so nothing is known about the name. */
    UNKNOWN
}
