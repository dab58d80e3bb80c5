package io.chessucimcp.core.option;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chessucimcp.core.error.UnsupportedOptionException;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionType;
import io.chessucimcp.core.model.OptionValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OptionRegistry")
class OptionRegistryTest {

    private OptionRegistry registry;

    @BeforeEach
    void setUp() {
        Map<String, OptionMetadata> metadata = new LinkedHashMap<>();
        metadata.put("Threads", new OptionMetadata("Threads", OptionType.SPIN, OptionValue.ofInteger(1), 1L, 8L, null));
        metadata.put("Hash", new OptionMetadata("Hash", OptionType.SPIN, OptionValue.ofInteger(16), 1L, 1024L, null));
        metadata.put("Clear Hash", new OptionMetadata("Clear Hash", OptionType.BUTTON, null, null, null, null));
        registry = new OptionRegistry(metadata);
    }

    @Test
    @DisplayName("Metadata keeps advertisement order and is read-only")
    void metadata() {
        assertThat(registry.all().keySet()).containsExactly("Threads", "Hash", "Clear Hash");
        assertThat(registry.find("Hash")).isPresent();
        assertThat(registry.find("hash")).isEmpty();
        assertThatThrownBy(() -> registry.all().remove("Hash")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("require() rejects unknown names")
    void requireUnknown() {
        assertThatThrownBy(() -> registry.require("Nope"))
                .isInstanceOf(UnsupportedOptionException.class)
                .hasMessageContaining("Nope");
    }

    @Test
    @DisplayName("Recorded values are returned as a copy; buttons are not recorded")
    void recordsValues() {
        registry.record("Hash", OptionValue.ofInteger(64));
        registry.record("Clear Hash", OptionValue.none());

        Map<String, OptionValue> snapshot = registry.currentValues();
        registry.record("Threads", OptionValue.ofInteger(4));

        assertThat(snapshot).containsExactly(Map.entry("Hash", OptionValue.ofInteger(64)));
        assertThat(registry.currentValues()).containsOnlyKeys("Hash", "Threads");
    }
}
