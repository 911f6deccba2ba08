package com.sceneanchor.infrastructure.anchor;

public class InvalidSpanException extends RuntimeException {

    public InvalidSpanException(String message) {
        super(message);
    }
}
