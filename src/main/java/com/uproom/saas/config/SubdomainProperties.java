package com.uproom.saas.config;

import com.uproom.saas.model.ReservedSubdomains;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly typed configuration for subdomain allocation.
 */
@Data
@Component
@ConfigurationProperties(prefix = "subdomain")
public class SubdomainProperties {

    /**
     * Names that can never be assigned to a tenant.
     */
    private List<String> reservedNames = new ArrayList<>(ReservedSubdomains.DEFAULT_NAMES);

    /**
     * Whether URLs are built against the production domain.
     */
    private boolean production = false;

    private String productionDomain = "uproom.com";

    private String developmentHost = "localhost:8080";

    /**
     * Scheme used for tenant URLs.
     */
    private String protocol = "https";

    /**
     * How many suffixed candidates are tried when the preferred name is taken.
     */
    private int alternativeCount = 5;
}
