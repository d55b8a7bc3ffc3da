package com.uproom.saas.testing;

import com.uproom.saas.model.Company;
import com.uproom.saas.repository.SubdomainRecordStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Record store fake that keeps companies in a map and remembers every lookup it served.
 */
public class InMemorySubdomainRecordStore implements SubdomainRecordStore {

    private final Map<String, Company> companies = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<String> lookups = new ArrayList<>();
    private long nextId = 1;

    public InMemorySubdomainRecordStore withTaken(String... subdomains) {
        for (String subdomain : subdomains) {
            Company company = new Company();
            company.setId(nextId++);
            company.setName(subdomain);
            company.setSubdomain(subdomain);
            company.setUrl("https://" + subdomain + ".uproom.com");
            companies.put(subdomain, company);
        }
        return this;
    }

    /** Lookups of these names throw, as an unreachable database would. */
    public InMemorySubdomainRecordStore withFailing(String... subdomains) {
        failing.addAll(List.of(subdomains));
        return this;
    }

    @Override
    public Optional<Company> findBySubdomain(String subdomain) {
        lookups.add(subdomain);
        if (failing.contains(subdomain)) {
            throw new IllegalStateException("connection refused");
        }
        return Optional.ofNullable(companies.get(subdomain));
    }

    public List<String> lookups() {
        return List.copyOf(lookups);
    }
}
