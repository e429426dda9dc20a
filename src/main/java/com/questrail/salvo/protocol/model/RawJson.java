package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * An opaque JSON value relayed verbatim between clients.
 *
 * <p>Ship placements are produced and consumed by client-side board logic.
 * The server keeps them as compact JSON text so that no JSON library type
 * escapes the codec layer.</p>
 *
 * @param json compact JSON text of a single value
 */
public record RawJson(String json) {
    public RawJson {
        Objects.requireNonNull(json, "json");
        if (json.isBlank()) {
            throw new IllegalArgumentException("json must not be blank");
        }
    }

    @Override
    public String toString() {
        return json;
    }
}
