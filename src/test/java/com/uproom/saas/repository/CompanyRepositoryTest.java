package com.uproom.saas.repository;

import com.uproom.saas.model.Company;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@DisplayName("CompanyRepository Tests")
class CompanyRepositoryTest {

    @Autowired
    private CompanyRepository companyRepository;

    private Company company(String name, String subdomain) {
        Company company = new Company();
        company.setName(name);
        company.setSubdomain(subdomain);
        company.setUrl("https://" + subdomain + ".uproom.com");
        return company;
    }

    @Test
    @DisplayName("finds a company by exact subdomain")
    void shouldFindBySubdomain() {
        companyRepository.saveAndFlush(company("Acme", "acme"));

        assertThat(companyRepository.findBySubdomain("acme")).isPresent()
            .get().extracting(Company::getName).isEqualTo("Acme");
        assertThat(companyRepository.findBySubdomain("acme-1")).isEmpty();
        assertThat(companyRepository.findBySubdomain("acm")).isEmpty();
    }

    @Test
    @DisplayName("the subdomain column is unique")
    void shouldRejectDuplicateSubdomain() {
        companyRepository.saveAndFlush(company("Acme", "acme"));

        assertThatThrownBy(() -> companyRepository.saveAndFlush(company("Acme Again", "acme")))
            .isInstanceOf(DataIntegrityViolationException.class);
    }
}
