package com.docbinder.core.i18n;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelResolverTest {

    @Test
    void forLocale_english_defaultLabels() {
        Labels labels = LabelResolver.forLocale("en_US");

        assertThat(labels.index()).isEqualTo("Index");
        assertThat(labels.contents()).isEqualTo("Contents");
        assertThat(labels.inPrefix() + "Title" + labels.inSuffix()).isEqualTo(" (in Title)");
    }

    @Test
    void forLocale_regionFallsBackToLanguage() {
        assertThat(LabelResolver.forLocale("es-AR").contents()).isEqualTo("Contenido");
        assertThat(LabelResolver.forLocale("de_DE").locale()).isEqualTo("de_DE");
    }

    @Test
    void forLocale_unknownOrBlank_fallsBackToEnglish() {
        assertThat(LabelResolver.forLocale("xx").index()).isEqualTo("Index");
        assertThat(LabelResolver.forLocale(null).index()).isEqualTo("Index");
        assertThat(LabelResolver.forLocale(" ").contents()).isEqualTo("Contents");
    }
}
