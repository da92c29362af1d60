package com.delta.jobharvester.harvest.dedup;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleNormalizerTest {

    @Test
    void cdlSpellingsFoldTogether() {
        String expected = TitleNormalizer.similarTitleKey("CDL-A Truck Driver");

        assertThat(TitleNormalizer.similarTitleKey("Class A Driver")).isEqualTo(expected);
        assertThat(TitleNormalizer.similarTitleKey("CDL A truck driver!")).isEqualTo(expected);
        assertThat(expected).isEqualTo("cdla driver");
    }

    @Test
    void experienceSynonymsFoldTogether() {
        assertThat(TitleNormalizer.similarTitleKey("Entry Level Dry Van Driver"))
            .isEqualTo(TitleNormalizer.similarTitleKey("No Experience Van Driver"));
    }

    @Test
    void unrelatedTitlesStayDistinct() {
        assertThat(TitleNormalizer.similarTitleKey("Diesel Mechanic"))
            .isNotEqualTo(TitleNormalizer.similarTitleKey("CDL-A Driver"));
    }

    @Test
    void nullTitleGivesEmptyKey() {
        assertThat(TitleNormalizer.similarTitleKey(null)).isEmpty();
    }
}
