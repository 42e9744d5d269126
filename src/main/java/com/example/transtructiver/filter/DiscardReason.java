package com.example.transtructiver.filter;

/**
 * Why a sample was excluded before mutation. {@link #code()} is the string written to logs.
 */
public enum DiscardReason {
    INVALID_UTF8("invalid_utf8"),
    EMPTY_SOURCE("empty_source"),
    NO_CHILDREN("no_children"),
    ROOT_ERROR_ONLY("root_error_only"),
    NO_MEANINGFUL_STRUCTURE("no_meaningful_structure");

    private final String code;

    DiscardReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
