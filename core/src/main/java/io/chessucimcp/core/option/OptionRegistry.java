package io.chessucimcp.core.option;

import io.chessucimcp.core.error.UnsupportedOptionException;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionType;
import io.chessucimcp.core.model.OptionValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Advertised option metadata of one engine plus the cache of values the bridge has sent.
 *
 * <p>
 * Metadata is fixed at construction. The value cache is advisory: UCI has no way to read an
 * option back, so it reflects what was sent, not what the engine holds. Access to the cache is
 * synchronized so readers can snapshot it while an update is in flight.
 */
public final class OptionRegistry {

    /** Registry of an engine that advertised nothing (before the handshake completes). */
    public static final OptionRegistry EMPTY = new OptionRegistry(Map.of());

    private final Map<String, OptionMetadata> metadata;
    private final Map<String, OptionValue> currentValues = new LinkedHashMap<>();

    public OptionRegistry(Map<String, OptionMetadata> metadata) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** All advertised options, in advertisement order. */
    public Map<String, OptionMetadata> all() {
        return metadata;
    }

    public Optional<OptionMetadata> find(String name) {
        return Optional.ofNullable(metadata.get(name));
    }

    /**
     * @throws UnsupportedOptionException if the engine did not advertise {@code name}
     */
    public OptionMetadata require(String name) {
        OptionMetadata meta = metadata.get(name);
        if (meta == null) {
            throw new UnsupportedOptionException(name);
        }
        return meta;
    }

    /** Records a sent value. Button presses are not recorded. */
    public synchronized void record(String name, OptionValue value) {
        OptionMetadata meta = metadata.get(name);
        if (meta != null && meta.type() != OptionType.BUTTON) {
            currentValues.put(name, value);
        }
    }

    /** Snapshot of the values sent so far. */
    public synchronized Map<String, OptionValue> currentValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(currentValues));
    }

    public int size() {
        return metadata.size();
    }
}
