package com.uproom.saas.config;

import com.uproom.saas.model.ReservedSubdomains;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class SubdomainConfig {
    @Bean
    public ReservedSubdomains reservedSubdomains(SubdomainProperties properties) {
        ReservedSubdomains reserved = ReservedSubdomains.of(properties.getReservedNames());
        log.info("Loaded {} reserved subdomains", reserved.size());
        return reserved;
    }

    @Bean
    public DomainConfig domainConfig(SubdomainProperties properties) {
        DomainConfig config = new DomainConfig(
            properties.getProductionDomain(),
            properties.getDevelopmentHost(),
            properties.isProduction());
        log.info("Tenant URLs resolve against {}", config.activeDomain());
        return config;
    }
}
