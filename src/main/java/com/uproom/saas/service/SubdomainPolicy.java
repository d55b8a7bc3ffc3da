package com.uproom.saas.service;

import com.uproom.saas.dto.FormatCheck;
import com.uproom.saas.model.ReservedSubdomains;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming rules for tenant subdomains.
 *
 * <p>Pure and stateless apart from the injected reserved set, so one instance is shared by all
 * request threads. Rule violations come back as {@link FormatCheck} data and are never thrown.
 */
@Component
@RequiredArgsConstructor
public class SubdomainPolicy {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 30;

    public static final String TOO_SHORT = "Subdomain must be at least 3 characters long";
    public static final String TOO_LONG = "Subdomain must be no more than 30 characters long";
    public static final String BAD_CHARSET =
        "Subdomain can only contain lowercase letters, numbers, and hyphens";
    public static final String EDGE_HYPHEN = "Subdomain cannot start or end with a hyphen";
    public static final String DOUBLE_HYPHEN = "Subdomain cannot contain consecutive hyphens";
    public static final String RESERVED = "This subdomain is reserved and cannot be used";

    private static final Pattern CHARSET = Pattern.compile("[a-z0-9-]+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-|-$");

    private final ReservedSubdomains reserved;

    /**
     * Derives a candidate subdomain from a free-text display name.
     *
     * <p>The result is at most {@value #MAX_LENGTH} characters of {@code [a-z0-9-]}, but may be
     * empty or too short; run it through {@link #validateFormat(String)} before use.
     */
    public String normalize(String displayName) {
        if (displayName == null) {
            return "";
        }
        String candidate = displayName.toLowerCase(Locale.ROOT);
        candidate = NON_ALPHANUMERIC.matcher(candidate).replaceAll("-");
        candidate = HYPHEN_RUN.matcher(candidate).replaceAll("-");
        candidate = EDGE_HYPHENS.matcher(candidate).replaceAll("");
        return candidate.length() > MAX_LENGTH ? candidate.substring(0, MAX_LENGTH) : candidate;
    }

    /**
     * Checks a candidate against the naming rules. The first failing rule wins, in this order:
     * minimum length, maximum length, character set, edge hyphens, consecutive hyphens, reserved.
     * A {@code null} candidate is treated as empty.
     */
    public FormatCheck validateFormat(String subdomain) {
        String candidate = subdomain == null ? "" : subdomain;

        if (candidate.length() < MIN_LENGTH) {
            return FormatCheck.invalid(TOO_SHORT);
        }
        if (candidate.length() > MAX_LENGTH) {
            return FormatCheck.invalid(TOO_LONG);
        }
        if (!CHARSET.matcher(candidate).matches()) {
            return FormatCheck.invalid(BAD_CHARSET);
        }
        if (candidate.startsWith("-") || candidate.endsWith("-")) {
            return FormatCheck.invalid(EDGE_HYPHEN);
        }
        if (candidate.contains("--")) {
            return FormatCheck.invalid(DOUBLE_HYPHEN);
        }
        if (reserved.contains(candidate)) {
            return FormatCheck.invalid(RESERVED);
        }
        return FormatCheck.valid();
    }
}
