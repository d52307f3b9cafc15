package com.polyglot.domain.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.polyglot.domain.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TutorProfile")
class TutorProfileTest {

    @Test
    @DisplayName("defaults() is balanced and conversational")
    void defaults() {
        var profile = TutorProfile.defaults();

        assertThat(profile.creativity()).isEqualTo(0.5);
        assertThat(profile.style()).isEqualTo(GenerationStyle.CONVERSATIONAL);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    @DisplayName("rejects creativity outside [0, 1]")
    void rejectsCreativity(double creativity) {
        assertThatThrownBy(() -> new TutorProfile(creativity, GenerationStyle.PRACTICE))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("accepts the bounds")
    void acceptsBounds() {
        assertThat(new TutorProfile(0.0, GenerationStyle.PRACTICE).creativity()).isZero();
        assertThat(new TutorProfile(1.0, GenerationStyle.PRACTICE).creativity()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("rejects a missing style")
    void rejectsNullStyle() {
        assertThatThrownBy(() -> new TutorProfile(0.3, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("style");
    }

    @Test
    @DisplayName("with* methods return new instances and leave the original alone")
    void copyOnWrite() {
        var original = TutorProfile.defaults();

        var changed = original.withCreativity(0.9).withStyle(GenerationStyle.CORRECTIVE);

        assertThat(changed).isEqualTo(new TutorProfile(0.9, GenerationStyle.CORRECTIVE));
        assertThat(original).isEqualTo(TutorProfile.defaults());
    }
}
