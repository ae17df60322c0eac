package com.example.acr.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AcrEditionTest {

    @Test
    @DisplayName("codes resolve case-insensitively")
    void fromCode() {
        assertThat(AcrEdition.fromCode("vpat2.5-eu")).contains(AcrEdition.EU);
        assertThat(AcrEdition.fromCode("VPAT-1")).isEmpty();
        assertThat(AcrEdition.fromCode(null)).isEmpty();
    }

    @Test
    @DisplayName("the International edition covers all three standards and is recommended")
    void international() {
        assertThat(AcrEdition.RECOMMENDED).isEqualTo(AcrEdition.INTERNATIONAL);
        assertThat(AcrEdition.INTERNATIONAL.standards()).containsExactly("Section 508", "EN 301 549", "WCAG 2.1");
        assertThat(AcrEdition.SECTION_508.displayName()).isEqualTo("Section 508 Edition");
    }

    @Test
    @DisplayName("JSON uses the edition code")
    void json() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(AcrEdition.WCAG)).isEqualTo("\"VPAT2.5-WCAG\"");
        assertThat(mapper.readValue("\"VPAT2.5-508\"", AcrEdition.class)).isEqualTo(AcrEdition.SECTION_508);
        assertThat(mapper.readValue("\"VPAT-OLD\"", AcrEdition.class)).isEqualTo(AcrEdition.RECOMMENDED);
    }

    @Test
    @DisplayName("conformance labels outside the four levels read as Not Applicable")
    void conformanceLabels() {
        assertThat(ConformanceLevel.fromLabel("Partially Supports")).isEqualTo(ConformanceLevel.PARTIALLY_SUPPORTS);
        assertThat(ConformanceLevel.fromLabel("supports")).isEqualTo(ConformanceLevel.SUPPORTS);
        assertThat(ConformanceLevel.fromLabel("Mostly")).isEqualTo(ConformanceLevel.NOT_APPLICABLE);
        assertThat(ConformanceLevel.fromLabel(null)).isEqualTo(ConformanceLevel.NOT_APPLICABLE);
    }
}
