package com.uproom.saas.service;

import com.uproom.saas.config.SubdomainProperties;
import com.uproom.saas.dto.FormatCheck;
import com.uproom.saas.dto.SubdomainSuggestion;
import com.uproom.saas.dto.SubdomainValidation;
import com.uproom.saas.model.Company;
import com.uproom.saas.repository.SubdomainRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Decides whether a subdomain can be handed to a tenant and finds fallbacks when it cannot.
 *
 * <p>Results are advisory. Nothing is reserved by a successful check; the unique constraint on
 * {@code companies.subdomain} stays the source of truth when the name is actually claimed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubdomainService {

    private final SubdomainPolicy policy;
    private final SubdomainRecordStore recordStore;
    private final SubdomainProperties properties;

    /**
     * Looks the subdomain up once. Store failures are reported as {@link Availability#UNKNOWN}.
     */
    public Availability lookup(String subdomain) {
        Optional<Company> owner;
        try {
            owner = recordStore.findBySubdomain(subdomain);
        } catch (RuntimeException e) {
            log.warn("Could not check availability of subdomain {}, treating it as taken", subdomain, e);
            return Availability.UNKNOWN;
        }

        if (owner.isEmpty()) {
            return Availability.AVAILABLE;
        }
        log.debug("Subdomain {} is owned by company {}", subdomain, owner.get().getId());
        return Availability.TAKEN;
    }

    /**
     * Fail-closed availability check: true only when the store positively confirmed that no
     * company owns the name.
     */
    public boolean checkAvailability(String subdomain) {
        return lookup(subdomain) == Availability.AVAILABLE;
    }

    /**
     * Format rules first, then the store. An invalid name never causes a lookup.
     */
    public SubdomainValidation validateSubdomain(String subdomain) {
        FormatCheck format = policy.validateFormat(subdomain);
        if (!format.isValid) {
            log.debug("Rejected subdomain {}: {}", subdomain, format.message);
            return SubdomainValidation.rejected(format);
        }
        return SubdomainValidation.checked(checkAvailability(subdomain));
    }

    /**
     * Lazily tries {@code base-1} through {@code base-count}, one lookup at a time, and yields the
     * candidates that are valid and available in ascending suffix order. Each call returns a new
     * stream, so the search can be repeated; it never looks past {@code count}.
     *
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public Stream<String> alternatives(String base, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Alternative count must not be negative: " + count);
        }
        String prefix = base == null ? "" : base;
        return IntStream.rangeClosed(1, count)
            .mapToObj(suffix -> prefix + "-" + suffix)
            .filter(candidate -> validateSubdomain(candidate).isUsable());
    }

    public List<String> generateAlternatives(String base, int count) {
        List<String> found = alternatives(base, count).collect(Collectors.toList());
        log.debug("Found {} of {} alternatives for {}", found.size(), count, base);
        return found;
    }

    public List<String> generateAlternatives(String base) {
        return generateAlternatives(base, properties.getAlternativeCount());
    }

    /**
     * Derives a subdomain from a display name. When the derived name is valid but taken, the
     * configured number of suffixed alternatives is searched as well.
     */
    public SubdomainSuggestion suggest(String displayName) {
        String candidate = policy.normalize(displayName);
        SubdomainValidation validation = validateSubdomain(candidate);

        if (validation.isValid && !validation.isAvailable) {
            return new SubdomainSuggestion(candidate, validation, generateAlternatives(candidate));
        }
        return new SubdomainSuggestion(candidate, validation, List.of());
    }
}
