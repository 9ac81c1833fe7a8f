package io.mnemo.core.vector;

public enum PayloadSchemaType {
    KEYWORD("keyword"),
    INTEGER("integer");

    private final String wireName;

    PayloadSchemaType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
