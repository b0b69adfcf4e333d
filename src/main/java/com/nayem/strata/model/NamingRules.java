package com.nayem.strata.model;

import java.util.List;

public record NamingRules(List<String> taxonomyOrder) {

    public NamingRules {
        taxonomyOrder = taxonomyOrder == null ? List.of() : List.copyOf(taxonomyOrder);
    }

    public static NamingRules empty() {
        return new NamingRules(List.of());
    }
}
