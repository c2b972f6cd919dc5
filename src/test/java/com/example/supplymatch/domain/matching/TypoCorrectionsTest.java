package com.example.supplymatch.domain.matching;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TypoCorrectionsTest {

    @Test
    void replacesWholeWordsOnly() {
        TypoCorrections corrections = TypoCorrections.defaults();

        assertThat(corrections.apply("авакадо хасс")).isEqualTo("авокадо хасс");
        assertThat(corrections.apply("листы нохот")).isEqualTo("листы нори");
        assertThat(corrections.apply("авакадовый соус")).isEqualTo("авакадовый соус");
    }

    @Test
    void additionalEntriesExtendTheVersion() {
        TypoCorrections extended = TypoCorrections.defaults().withAdditional(Map.of("Малако", "молоко"));

        assertThat(extended.version()).isEqualTo("2+1");
        assertThat(extended.entries()).containsEntry("малако", "молоко").hasSize(4);
        assertThat(extended.apply("малако 3,2%")).isEqualTo("молоко 3,2%");
    }

    @Test
    void emptyTableLeavesQueryUntouched() {
        assertThat(TypoCorrections.none().apply("авакадо")).isEqualTo("авакадо");
        assertThat(TypoCorrections.defaults().withAdditional(Map.of()).version())
                .isEqualTo(TypoCorrections.DEFAULT_VERSION);
    }
}
