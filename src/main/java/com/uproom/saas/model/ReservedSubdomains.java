package com.uproom.saas.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of names that can never be assigned to a tenant.
 */
public final class ReservedSubdomains {

    public static final List<String> DEFAULT_NAMES = List.of(
        "www", "api", "admin", "app", "mail", "ftp", "blog", "shop", "store",
        "support", "help", "docs", "dev", "test", "staging", "prod", "production",
        "dashboard", "portal", "login", "register", "auth", "account", "profile",
        "settings", "config", "status", "health", "ping", "webhook", "callback",
        "assets", "static", "cdn", "media", "images", "files", "uploads"
    );

    private final Set<String> names;

    private ReservedSubdomains(Set<String> names) {
        this.names = names;
    }

    public static ReservedSubdomains defaults() {
        return of(DEFAULT_NAMES);
    }

    public static ReservedSubdomains of(Collection<String> names) {
        return new ReservedSubdomains(names.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toUnmodifiableSet()));
    }

    public boolean contains(String subdomain) {
        return subdomain != null && names.contains(subdomain);
    }

    public int size() {
        return names.size();
    }
}
