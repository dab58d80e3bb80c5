package io.chessucimcp.core.model;

import java.util.Optional;

/**
 * Engine identity from the {@code id name} and {@code id author} handshake lines. Either part
 * may be missing; engines are not required to send both.
 */
public record EngineId(String name, String author) {

    /** Identity of an engine that sent no {@code id} lines. */
    public static final EngineId UNKNOWN = new EngineId(null, null);

    public Optional<String> nameOpt() {
        return Optional.ofNullable(name);
    }

    public Optional<String> authorOpt() {
        return Optional.ofNullable(author);
    }
}
