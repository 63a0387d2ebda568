package com.sparrowlogic.infracompiler.model;

public enum GranteeType {
    CANONICAL_USER("CanonicalUser"),
    AMAZON_CUSTOMER_BY_EMAIL("AmazonCustomerByEmail"),
    GROUP("Group");

    private final String value;

    GranteeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
