package com.docbinder.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderOptionsTest {

    @Test
    void defaults_matchDocumentedValues() {
        RenderOptions options = RenderOptions.defaults();

        assertThat(options.stylesheets()).containsExactly("sphinx");
        assertThat(options.pageTemplate()).isEqualTo("decoratedPage");
        assertThat(options.tocDepth()).isEqualTo(9999);
        assertThat(options.useToc()).isTrue();
        assertThat(options.useCoverpage()).isTrue();
        assertThat(options.inlineFootnotes()).isTrue();
        assertThat(options.invariant()).isFalse();
        assertThat(options.defaultDpi()).isEqualTo(300);
    }

    @Test
    void withOverrides_knownKeys_replaceValuesAndConvertTypes() {
        // Given
        RenderOptions options = RenderOptions.defaults();

        // When
        RenderOptions merged = options.withOverrides(Map.of(
            "tocDepth", "2",
            "stylesheets", List.of("a4", "twocolumn"),
            "invariant", true,
            "appendices", List.of("glossary")));

        // Then
        assertThat(merged.tocDepth()).isEqualTo(2);
        assertThat(merged.stylesheets()).containsExactly("a4", "twocolumn");
        assertThat(merged.invariant()).isTrue();
        assertThat(merged.pageTemplate()).isEqualTo("decoratedPage");
        assertThat(options.tocDepth()).isEqualTo(9999);
    }

    @Test
    void withOverrides_wrongType_throwsIllegalArgument() {
        assertThatThrownBy(() -> RenderOptions.defaults().withOverrides(Map.of("defaultDpi", "high")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void asMap_containsEveryOption() {
        assertThat(RenderOptions.defaults().asMap()).containsOnlyKeys(RenderOptions.OPTION_NAMES);
    }
}
