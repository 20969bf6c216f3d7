package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RouteSource {
    RULE("rule"),
    SEMANTIC("semantic");

    private final String code;

    RouteSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
