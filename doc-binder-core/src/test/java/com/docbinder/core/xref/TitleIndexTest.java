package com.docbinder.core.xref;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TitleIndexTest {

    @Test
    void prefixOf_indexDocument_dropsIndexComponent() {
        assertThat(TitleIndex.prefixOf("api/index")).isEqualTo("api/");
        assertThat(TitleIndex.prefixOf("index")).isEqualTo("index");
        assertThat(TitleIndex.prefixOf("guide")).isEqualTo("guide");
    }

    @Test
    void titleFor_firstMatchingPrefixWins() {
        // Given
        TitleIndex titles = new TitleIndex(List.of(
            new TitleIndex.Entry("api/", "API Reference"),
            new TitleIndex.Entry("api/widgets", "Widgets")));

        // When / Then
        assertThat(titles.titleFor("api/widgets")).contains("API Reference");
        assertThat(titles.titleFor("guide")).isEmpty();
        assertThat(titles.titleFor(null)).isEmpty();
    }
}
