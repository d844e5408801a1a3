package io.github.cyfko.roaql.core.model;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String token;

    SortDirection(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
