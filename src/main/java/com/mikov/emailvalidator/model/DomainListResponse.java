package com.mikov.emailvalidator.model;

import java.util.List;

public record DomainListResponse(int count, List<String> domains) {

    public static DomainListResponse of(final List<String> domains) {
        return new DomainListResponse(domains.size(), domains);
    }
}
