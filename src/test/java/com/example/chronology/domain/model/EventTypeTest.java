package com.example.chronology.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeTest {

    @Test
    void labelsAreMatchedAfterTrimAndTitleCase() {
        assertThat(EventType.fromLabel("  JUDGMENT ")).isEqualTo(EventType.JUDGMENT);
        assertThat(EventType.fromLabel("adjournment")).isEqualTo(EventType.ADJOURNMENT);
    }

    @Test
    void unknownLabelsFallBackToGenericEvent() {
        assertThat(EventType.fromLabel("Arrest")).isEqualTo(EventType.EVENT);
        assertThat(EventType.fromLabel(null)).isEqualTo(EventType.EVENT);
        assertThat(EventType.fromLabelOrNull("Arrest")).isNull();
    }

    @Test
    void titleCaseCapitalizesEachWord() {
        assertThat(EventType.titleCase("final HEARING")).isEqualTo("Final Hearing");
    }
}
