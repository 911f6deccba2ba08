package com.sceneanchor.domain.anchor.model;

public enum UnresolvedReason {
    RESOLUTION_FAILED("anchor-resolution-failed"),
    EXCEPTION("anchor-exception");

    private final String code;

    UnresolvedReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
