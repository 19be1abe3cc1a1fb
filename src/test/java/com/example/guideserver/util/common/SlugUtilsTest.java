package com.example.guideserver.util.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlugUtils")
class SlugUtilsTest {

    @Test
    @DisplayName("collapses non-alphanumerics into single dashes")
    void slugify() {
        assertThat(SlugUtils.slugify("Heading 1")).isEqualTo("heading-1");
        assertThat(SlugUtils.slugify("  Course_9 ")).isEqualTo("course-9");
        assertThat(SlugUtils.slugify("--Anti/Coagulants & More!--")).isEqualTo("anti-coagulants-more");
        assertThat(SlugUtils.slugify("***")).isEmpty();
        assertThat(SlugUtils.slugify(null)).isEmpty();
    }

    @Test
    @DisplayName("stem drops only the last extension")
    void stem() {
        assertThat(SlugUtils.stem("Cardio_Guide.docx")).isEqualTo("Cardio_Guide");
        assertThat(SlugUtils.stem("v1.2 notes.docx")).isEqualTo("v1.2 notes");
        assertThat(SlugUtils.stem(".hidden")).isEqualTo(".hidden");
        assertThat(SlugUtils.stem("README")).isEqualTo("README");
    }
}
