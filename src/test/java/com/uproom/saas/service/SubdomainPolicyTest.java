package com.uproom.saas.service;

import com.uproom.saas.dto.FormatCheck;
import com.uproom.saas.model.ReservedSubdomains;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubdomainPolicy Tests")
class SubdomainPolicyTest {

    private SubdomainPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new SubdomainPolicy(ReservedSubdomains.defaults());
    }

    static List<String> reservedNames() {
        return ReservedSubdomains.DEFAULT_NAMES;
    }

    private void assertRejected(String candidate, String message) {
        FormatCheck check = policy.validateFormat(candidate);
        assertThat(check.isValid).as("valid(%s)", candidate).isFalse();
        assertThat(check.message).as("message(%s)", candidate).isEqualTo(message);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(value = {
            "Acme Corp!!|acme-corp",
            "  Hello   World  |hello-world",
            "ÀBC Ltd.|bc-ltd",
            "---abc---|abc",
            "a_b_c|a-b-c",
            "Company 42|company-42",
            "already-fine|already-fine",
            "!!!|''",
        }, delimiter = '|')
        void shouldNormalizeDisplayNames(String displayName, String expected) {
            assertThat(policy.normalize(displayName)).isEqualTo(expected);
        }

        @Test
        @DisplayName("empty and null input give an empty candidate")
        void shouldReturnEmptyForEmptyInput() {
            assertThat(policy.normalize("")).isEmpty();
            assertThat(policy.normalize(null)).isEmpty();
        }

        @Test
        @DisplayName("output is truncated to 30 characters")
        void shouldTruncateLongNames() {
            String normalized = policy.normalize("The Quite Extraordinarily Long Company Name Incorporated");
            assertThat(normalized).hasSize(30).isEqualTo("the-quite-extraordinarily-long");
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "Ünïcödé Søftware GmbH & Co. KG",
            "🚀 Rocket 🚀 Labs",
            "x",
            "A very, very, very, very, very long name with punctuation!?",
            "UPPER lower 123 ___ ..."
        })
        @DisplayName("output always satisfies the length ceiling and charset")
        void shouldAlwaysProduceCharsetSafeOutput(String displayName) {
            String normalized = policy.normalize(displayName);
            assertThat(normalized.length()).isLessThanOrEqualTo(SubdomainPolicy.MAX_LENGTH);
            assertThat(normalized).matches("[a-z0-9-]*");
            assertThat(normalized).doesNotContain("--");
        }

        @Test
        @DisplayName("normalized output may still be too short")
        void shouldNotGuaranteeValidity() {
            String normalized = policy.normalize("A!");
            assertThat(normalized).isEqualTo("a");
            assertRejected(normalized, SubdomainPolicy.TOO_SHORT);
        }
    }

    @Nested
    @DisplayName("Format Validation")
    class FormatValidation {

        @ParameterizedTest
        @ValueSource(strings = {"acme", "acme-corp", "a1b", "123", "abc-def-ghi", "abcdefghijabcdefghijabcdefghij"})
        void shouldAcceptValidNames(String candidate) {
            FormatCheck check = policy.validateFormat(candidate);
            assertThat(check.isValid).isTrue();
            assertThat(check.message).isEqualTo("Valid subdomain format");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "a", "ab", "A", "--", "!!", "A-", "-"})
        @DisplayName("names shorter than 3 characters are too short whatever they contain")
        void shouldRejectShortNames(String candidate) {
            assertRejected(candidate, SubdomainPolicy.TOO_SHORT);
        }

        @Test
        @DisplayName("null is treated as empty")
        void shouldRejectNull() {
            assertRejected(null, SubdomainPolicy.TOO_SHORT);
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "abcdefghijabcdefghijabcdefghijk",
            "ABCDEFGHIJABCDEFGHIJABCDEFGHIJK",
            "-bcdefghijabcdefghij--cdefghijk-",
            "www-www-www-www-www-www-www-www"
        })
        @DisplayName("names longer than 30 characters are too long even when everything else fails too")
        void shouldRejectLongNames(String candidate) {
            assertRejected(candidate, SubdomainPolicy.TOO_LONG);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Acme", "acme_corp", "acme.corp", "acme corp", "-Acme-", "ac--mE", "ÄBC", "admin!"})
        @DisplayName("uppercase or foreign characters fail the charset rule before hyphen rules")
        void shouldRejectBadCharset(String candidate) {
            assertRejected(candidate, SubdomainPolicy.BAD_CHARSET);
        }

        @ParameterizedTest
        @ValueSource(strings = {"-abc", "abc-", "-abc-", "--abc", "ab--cd-"})
        @DisplayName("leading or trailing hyphens win over consecutive hyphens")
        void shouldRejectEdgeHyphens(String candidate) {
            assertRejected(candidate, SubdomainPolicy.EDGE_HYPHEN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"ab--cd", "a---b", "x--y--z"})
        void shouldRejectConsecutiveHyphens(String candidate) {
            assertRejected(candidate, SubdomainPolicy.DOUBLE_HYPHEN);
        }

        @ParameterizedTest
        @MethodSource("com.uproom.saas.service.SubdomainPolicyTest#reservedNames")
        @DisplayName("every built-in reserved name is rejected")
        void shouldRejectReservedNames(String reserved) {
            if (reserved.length() < SubdomainPolicy.MIN_LENGTH) {
                assertRejected(reserved, SubdomainPolicy.TOO_SHORT);
            } else {
                assertRejected(reserved, SubdomainPolicy.RESERVED);
            }
        }

        @Test
        @DisplayName("admin, api and www are reserved")
        void shouldRejectWellKnownReservedNames() {
            assertRejected("admin", SubdomainPolicy.RESERVED);
            assertRejected("api", SubdomainPolicy.RESERVED);
            assertRejected("www", SubdomainPolicy.RESERVED);
        }

        @Test
        @DisplayName("reserved names are matched exactly")
        void shouldAcceptNamesContainingReservedWords() {
            assertThat(policy.validateFormat("admin-team").isValid).isTrue();
            assertThat(policy.validateFormat("myapi").isValid).isTrue();
        }
    }

    @Nested
    @DisplayName("Injected Reserved Set")
    class InjectedReservedSet {

        @Test
        @DisplayName("a custom reserved set replaces the built-in one")
        void shouldUseInjectedNames() {
            SubdomainPolicy custom = new SubdomainPolicy(ReservedSubdomains.of(List.of("acme", " Globex ")));

            assertThat(custom.validateFormat("acme").message).isEqualTo(SubdomainPolicy.RESERVED);
            assertThat(custom.validateFormat("globex").message).isEqualTo(SubdomainPolicy.RESERVED);
            assertThat(custom.validateFormat("admin").isValid).isTrue();
        }

        @Test
        @DisplayName("an empty reserved set rejects nothing on that rule")
        void shouldAllowEverythingWithEmptySet() {
            SubdomainPolicy open = new SubdomainPolicy(ReservedSubdomains.of(List.of()));
            assertThat(open.validateFormat("www").isValid).isTrue();
        }
    }
}
