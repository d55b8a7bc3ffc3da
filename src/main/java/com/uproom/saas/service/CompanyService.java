package com.uproom.saas.service;

import com.uproom.saas.dto.SubdomainValidation;
import com.uproom.saas.exception.InvalidSubdomainException;
import com.uproom.saas.exception.SubdomainConflictException;
import com.uproom.saas.model.Company;
import com.uproom.saas.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyService {
    private final CompanyRepository companyRepository;
    private final SubdomainService subdomainService;
    private final SubdomainPolicy subdomainPolicy;
    private final SubdomainUrls subdomainUrls;

    /**
     * Registers a company under the requested subdomain, or under one derived from its name.
     *
     * @throws InvalidSubdomainException if the subdomain breaks a naming rule
     * @throws SubdomainConflictException if another company owns the subdomain, including when
     *     the unique constraint rejects the insert after a successful check
     */
    public Company createCompany(String name, String requestedSubdomain) {
        String subdomain = requestedSubdomain == null || requestedSubdomain.isBlank()
            ? subdomainPolicy.normalize(name)
            : requestedSubdomain.trim();

        SubdomainValidation validation = subdomainService.validateSubdomain(subdomain);
        if (!validation.isValid) {
            throw new InvalidSubdomainException(subdomain, validation.message);
        }
        if (!validation.isAvailable) {
            throw new SubdomainConflictException(subdomain, subdomainService.generateAlternatives(subdomain));
        }

        Company company = new Company();
        company.setName(name.trim());
        company.setSubdomain(subdomain);
        company.setUrl(subdomainUrls.urlFor(subdomain));

        try {
            company = companyRepository.saveAndFlush(company);
        } catch (DataIntegrityViolationException e) {
            log.warn("Subdomain {} was claimed concurrently", subdomain);
            throw new SubdomainConflictException(subdomain, subdomainService.generateAlternatives(subdomain), e);
        }

        log.info("Registered company {} at {}", company.getId(), company.getUrl());
        return company;
    }

    public List<Company> getAllCompanies() {
        return companyRepository.findAll();
    }

    public Optional<Company> getCompanyById(Long id) {
        return companyRepository.findById(id);
    }

    public Optional<Company> getCompanyBySubdomain(String subdomain) {
        return companyRepository.findBySubdomain(subdomain);
    }

    /**
     * Resolves the company addressed by a request {@code Host} header.
     */
    public Optional<Company> getCompanyForHost(String hostHeader) {
        return SubdomainUrls.extractSubdomainFromHost(SubdomainUrls.hostnameOf(hostHeader))
            .flatMap(companyRepository::findBySubdomain);
    }
}
