package com.harvest.jobcrawler.crawl.healing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TitleSimilarityTest {

    @Test
    void identicalTitlesIgnoringCaseAreFullyAlike() {
        assertThat(TitleSimilarity.similarity("Backend Engineer", "backend ENGINEER")).isEqualTo(1.0);
    }

    @Test
    void scoresByEditDistanceOverLongerTitle() {
        assertThat(TitleSimilarity.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(TitleSimilarity.similarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
    }

    @Test
    void missingTitleScoresZeroAgainstAnything() {
        assertThat(TitleSimilarity.similarity(null, "Backend Engineer")).isEqualTo(0.0);
        assertThat(TitleSimilarity.similarity(null, null)).isEqualTo(1.0);
    }
}
