package com.openavail.availability.domain.model;

public record Credentials(String username, String password, String companyId) {

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", companyId=" + companyId + "]";
    }
}
