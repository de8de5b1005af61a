package com.example.preload.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PreloadCacheSettingsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        PreloadCacheSettings settings = PreloadCacheSettings.defaults();

        assertThat(settings.getCapacity()).isEqualTo(10);
        assertThat(settings.getBatchWidth()).isEqualTo(3);
        assertThat(settings.getLoadTimeout()).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void rejectsNonPositiveValues() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new PreloadCacheSettings(0, 3, Duration.ofSeconds(1)));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new PreloadCacheSettings(10, 0, Duration.ofSeconds(1)));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new PreloadCacheSettings(10, 3, Duration.ZERO));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new PreloadCacheSettings(10, 3, Duration.ofSeconds(1), 0));
    }
}
