package com.moddock.api.ids;

/**
 * Random id space exhausted: every attempt collided with an existing id.
 * Operational anomaly, never a client error.
 */
public class IdGenerationException extends RuntimeException {

    private final IdKind kind;

    public IdGenerationException(IdKind kind, int attempts) {
        super("Could not generate a free " + kind + " id after " + attempts + " attempts");
        this.kind = kind;
    }

    public IdKind getKind() {
        return kind;
    }
}
