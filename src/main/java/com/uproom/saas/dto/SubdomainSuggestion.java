package com.uproom.saas.dto;

import java.util.List;

public class SubdomainSuggestion {
    public final String candidate;
    public final SubdomainValidation validation;
    public final List<String> alternatives;

    public SubdomainSuggestion(String candidate, SubdomainValidation validation, List<String> alternatives) {
        this.candidate = candidate;
        this.validation = validation;
        this.alternatives = List.copyOf(alternatives);
    }
}
