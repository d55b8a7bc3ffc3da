package com.uproom.saas.repository;

import com.uproom.saas.model.Company;
import java.util.Optional;

/**
 * Point lookup of the company that owns a subdomain.
 *
 * <p>Implementations may throw any {@link RuntimeException} when the lookup cannot be completed.
 */
public interface SubdomainRecordStore {
    Optional<Company> findBySubdomain(String subdomain);
}
