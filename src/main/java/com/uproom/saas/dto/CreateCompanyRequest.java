package com.uproom.saas.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class CreateCompanyRequest {
    @NotBlank(message = "Company name is required")
    @Size(max = 120, message = "Company name must be no more than 120 characters long")
    public String name;

    // optional, derived from the name when absent
    public String subdomain;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSubdomain() { return subdomain; }
    public void setSubdomain(String subdomain) { this.subdomain = subdomain; }
}
