package com.uproom.saas.controller;

import com.uproom.saas.dto.SubdomainSuggestion;
import com.uproom.saas.dto.SubdomainValidation;
import com.uproom.saas.service.SubdomainService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/subdomains")
@RequiredArgsConstructor
public class SubdomainController {
    private final SubdomainService subdomainService;

    @GetMapping("/suggestions")
    public ResponseEntity<SubdomainSuggestion> suggest(@RequestParam @NotBlank String name) {
        return ResponseEntity.ok(subdomainService.suggest(name));
    }

    @GetMapping("/{subdomain}")
    public ResponseEntity<SubdomainValidation> validate(@PathVariable String subdomain) {
        return ResponseEntity.ok(subdomainService.validateSubdomain(subdomain));
    }

    @GetMapping("/{subdomain}/alternatives")
    public ResponseEntity<List<String>> alternatives(
            @PathVariable String subdomain,
            @RequestParam(defaultValue = "5") @Min(0) @Max(50) int count) {
        log.debug("Searching {} alternatives for {}", count, subdomain);
        return ResponseEntity.ok(subdomainService.generateAlternatives(subdomain, count));
    }
}
