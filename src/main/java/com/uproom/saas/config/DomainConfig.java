package com.uproom.saas.config;

import lombok.Value;

/**
 * Where tenant subdomains are hosted: the public domain in production, a local host otherwise.
 */
@Value
public class DomainConfig {
    String productionDomain;
    String developmentHost;
    boolean production;

    public String activeDomain() {
        return production ? productionDomain : developmentHost;
    }
}
