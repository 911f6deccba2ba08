package com.sceneanchor.infrastructure.anchor;

public class MalformedFingerprintException extends RuntimeException {

    public MalformedFingerprintException(String message) {
        super(message);
    }
}
