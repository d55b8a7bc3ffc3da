package com.uproom.saas.repository;

import com.uproom.saas.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long>, SubdomainRecordStore {
    @Override
    Optional<Company> findBySubdomain(String subdomain);
}
