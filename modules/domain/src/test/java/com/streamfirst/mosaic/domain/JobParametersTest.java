package com.streamfirst.mosaic.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JobParametersTest {

    @Test
    void acceptsBoundaryValues() {
        assertThat(new JobParameters(8, 0, 0.0, 0.0).cellSize()).isEqualTo(8);
        assertThat(new JobParameters(256, 500, 1.0, 1.0).repeatWindowK()).isEqualTo(500);
    }

    @Test
    void defaultsAreWithinBounds() {
        assertThat(JobParameters.DEFAULTS)
                .isEqualTo(new JobParameters(32, 30, 0.35, 0.0));
    }

    @Test
    void rejectsCellSizeOutOfRange() {
        assertThatThrownBy(() -> new JobParameters(7, 30, 0.35, 0.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cellSize");
        assertThatThrownBy(() -> new JobParameters(257, 30, 0.35, 0.0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsRepeatWindowOutOfRange() {
        assertThatThrownBy(() -> new JobParameters(32, -1, 0.35, 0.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("repeatWindowK");
        assertThatThrownBy(() -> new JobParameters(32, 501, 0.35, 0.0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsStrengthsOutsideUnitInterval() {
        assertThatThrownBy(() -> new JobParameters(32, 30, 1.01, 0.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("colorStrength");
        assertThatThrownBy(() -> new JobParameters(32, 30, 0.35, -0.1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("overlayStrength");
        assertThatThrownBy(() -> new JobParameters(32, 30, Double.NaN, 0.0))
                .isInstanceOf(ValidationException.class);
    }
}
