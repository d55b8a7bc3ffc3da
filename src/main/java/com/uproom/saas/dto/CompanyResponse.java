package com.uproom.saas.dto;

import java.time.LocalDateTime;

public class CompanyResponse {
    public Long id;
    public String name;
    public String subdomain;
    public String url;
    public LocalDateTime createdAt;

    public CompanyResponse(Long id, String name, String subdomain,
                           String url, LocalDateTime createdAt) {
        this.id = id;
        this.name = name;
        this.subdomain = subdomain;
        this.url = url;
        this.createdAt = createdAt;
    }
}
