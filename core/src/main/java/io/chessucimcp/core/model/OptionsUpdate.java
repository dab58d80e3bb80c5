package io.chessucimcp.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of applying a batch of option values. Every requested name appears in exactly one
 * of the two maps.
 *
 * @param applied values validated and sent to the engine
 * @param errors  per-option rejection messages
 */
public record OptionsUpdate(Map<String, OptionValue> applied, Map<String, String> errors) {

    public OptionsUpdate {
        applied = Collections.unmodifiableMap(new LinkedHashMap<>(applied));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /** {@code true} if no option was rejected. */
    public boolean success() {
        return errors.isEmpty();
    }
}
