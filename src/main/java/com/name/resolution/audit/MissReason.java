package com.name.resolution.audit;

/**
 * Why a numeric identifier could not be resolved.
 */
public enum MissReason {
    BACKEND_UNAVAILABLE("backend_unavailable"),
    NOT_FOUND_IN_BACKEND("not_found_in_backend");

    private final String code;

    MissReason(String code) {
        this.code = code;
    }

    /**
     * Value written to the miss log.
     */
    public String getCode() {
        return code;
    }
}
