package com.qanun.document.model;

/**
 * Kind of legal instrument a document represents
 */
public enum LawType {
    LAW("law"),
    DECREE("decree"),
    REGULATION("regulation"),
    DIRECTIVE("directive");

    private final String value;

    LawType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
