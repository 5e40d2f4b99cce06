package com.docbinder.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentSettingsTest {

    @Test
    void resolve_noOverrides_usesRunConfiguration() {
        // Given
        BinderConfig config = BinderConfig.defaults();
        OutputDocument document = new OutputDocument("index", null, "Manual", "Ann");

        // When
        DocumentSettings settings = DocumentSettings.resolve(config, document);

        // Then
        assertThat(settings.useIndex()).isTrue();
        assertThat(settings.appendices()).isEmpty();
        assertThat(settings.language()).isEqualTo("en_US");
        assertThat(settings.render()).isEqualTo(config.render());
    }

    @Test
    void resolve_documentOptions_overrideRunConfiguration() {
        // Given
        OutputDocument document = new OutputDocument("api/index", null, "API", "Ann", Map.of(
            "useIndex", "false",
            "appendices", List.of("glossary", "license"),
            "language", "de",
            "tocDepth", 3,
            "unheardOf", "x"));

        // When
        DocumentSettings settings = DocumentSettings.resolve(BinderConfig.defaults(), document);

        // Then
        assertThat(settings.document().targetName()).isEqualTo("api-index");
        assertThat(settings.useIndex()).isFalse();
        assertThat(settings.appendices()).containsExactly("glossary", "license");
        assertThat(settings.language()).isEqualTo("de");
        assertThat(settings.render().tocDepth()).isEqualTo(3);
    }

    @Test
    void resolve_badOptionType_throwsIllegalArgument() {
        // Given
        OutputDocument document = new OutputDocument("index", null, "", "", Map.of("useToc", List.of("x")));

        // When / Then
        assertThatThrownBy(() -> DocumentSettings.resolve(BinderConfig.defaults(), document))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromValue_domainIndexSelection() {
        assertThat(DomainIndexSelection.fromValue(null).all()).isTrue();
        assertThat(DomainIndexSelection.fromValue("no").all()).isFalse();
        assertThat(DomainIndexSelection.fromValue(List.of("py-modindex")).includes("py-modindex")).isTrue();
        assertThatThrownBy(() -> DomainIndexSelection.fromValue(42)).isInstanceOf(IllegalArgumentException.class);
    }
}
