package com.camsentinel.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineSettings}.
 */
class PipelineSettingsTest {

    @Test
    @DisplayName("Should use the documented defaults")
    void shouldUseDefaults() {
        PipelineSettings settings = PipelineSettings.builder().build();

        assertThat(settings.getPostDetectionDuration()).isEqualTo(Duration.ofSeconds(15));
        assertThat(settings.getTickInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.getMaxReconnectAttempts()).isZero();
        assertThat(settings.isRestartOnFailure()).isTrue();
        assertThat(settings.getPersonTopic()).isEqualTo("PeopleDetect");
    }

    @Test
    @DisplayName("Should reject a renew margin not shorter than the subscription")
    void shouldRejectRenewMargin() {
        assertThatThrownBy(() -> PipelineSettings.builder()
                .subscriptionDuration(Duration.ofSeconds(30))
                .renewMargin(Duration.ofSeconds(30))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("renewMargin");
    }

    @Test
    @DisplayName("Should reject a non-positive post-detection duration")
    void shouldRejectZeroTail() {
        assertThatThrownBy(() -> PipelineSettings.builder().postDetectionDuration(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("postDetectionDuration");
    }

    @Test
    @DisplayName("Should reject a backoff cap below its base")
    void shouldRejectBackoffCap() {
        assertThatThrownBy(() -> PipelineSettings.builder()
                .backoffBase(Duration.ofSeconds(10))
                .backoffMax(Duration.ofSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
