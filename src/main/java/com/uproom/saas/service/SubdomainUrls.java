package com.uproom.saas.service;

import com.uproom.saas.config.DomainConfig;
import com.uproom.saas.config.SubdomainProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Formatting helpers between subdomains, tenant URLs and request hosts. No validation happens here.
 */
@Component
@RequiredArgsConstructor
public class SubdomainUrls {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1");

    private final DomainConfig domainConfig;
    private final SubdomainProperties properties;

    public String urlFor(String subdomain) {
        return buildUrl(subdomain, properties.getProtocol(), domainConfig);
    }

    public static String buildUrl(String subdomain, String protocol, DomainConfig config) {
        return protocol + "://" + subdomain + "." + config.activeDomain();
    }

    /**
     * Returns the leftmost label of a host with at least three labels, e.g. {@code tenant} for
     * {@code tenant.uproom.com}. Loopback hosts and bare domains have no tenant.
     */
    public static Optional<String> extractSubdomainFromHost(String hostname) {
        if (hostname == null || LOOPBACK_HOSTS.contains(hostname)) {
            return Optional.empty();
        }
        String[] parts = hostname.split("\\.", -1);
        if (parts.length >= 3) {
            return Optional.of(parts[0]);
        }
        return Optional.empty();
    }

    /**
     * Lowercases a {@code Host} header value and strips its port. Bracketed IPv6 literals keep
     * their port.
     */
    public static String hostnameOf(String hostHeader) {
        if (hostHeader == null) {
            return null;
        }
        String host = hostHeader.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("[")) {
            return host;
        }
        int colon = host.indexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }
}
