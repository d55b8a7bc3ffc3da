package com.uproom.saas.controller;

import com.uproom.saas.dto.CompanyResponse;
import com.uproom.saas.dto.CreateCompanyRequest;
import com.uproom.saas.exception.CompanyNotFoundException;
import com.uproom.saas.model.Company;
import com.uproom.saas.service.CompanyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/companies")
@RequiredArgsConstructor
public class CompanyController {
    private final CompanyService companyService;

    @PostMapping
    public ResponseEntity<CompanyResponse> createCompany(@Valid @RequestBody CreateCompanyRequest request) {
        log.info("Creating company: {}", request.getName());
        Company company = companyService.createCompany(request.getName(), request.getSubdomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(company));
    }

    @GetMapping
    public ResponseEntity<List<CompanyResponse>> getAllCompanies() {
        return ResponseEntity.ok(companyService.getAllCompanies().stream()
            .map(this::toResponse).collect(Collectors.toList()));
    }

    @GetMapping("/current")
    public ResponseEntity<CompanyResponse> getCurrentCompany(@RequestHeader(HttpHeaders.HOST) String host) {
        return companyService.getCompanyForHost(host)
            .map(c -> ResponseEntity.ok(toResponse(c)))
            .orElseThrow(() -> new CompanyNotFoundException("No company is served at " + host));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CompanyResponse> getCompany(@PathVariable Long id) {
        return companyService.getCompanyById(id)
            .map(c -> ResponseEntity.ok(toResponse(c)))
            .orElse(ResponseEntity.notFound().build());
    }

    private CompanyResponse toResponse(Company c) {
        return new CompanyResponse(c.getId(), c.getName(), c.getSubdomain(),
            c.getUrl(), c.getCreatedAt());
    }
}
