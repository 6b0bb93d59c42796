package com.finlogic.skill_gap.service;

import com.finlogic.skill_gap.model.KeywordCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordDeduplicatorTest {

    private final KeywordDeduplicator deduplicator = new KeywordDeduplicator();

    @Test
    void deduplicate_shouldCollapseFrameworkVariantIntoLongerForm() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("React.js", 100),
                KeywordCandidate.of("React", 100),
                KeywordCandidate.of("JavaScript", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("React.js", "JavaScript");
    }

    @Test
    void deduplicate_shouldKeepHigherScoreForSameNormalizedForm() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Data Pipelines", 60),
                KeywordCandidate.of("data-pipelines", 80)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("data-pipelines");
    }

    @Test
    void deduplicate_shouldKeepFirstOnScoreTieForSameNormalizedForm() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Node.js", 100),
                KeywordCandidate.of("NodeJS", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("Node.js");
    }

    @Test
    void deduplicate_shouldLetLongerTermSupersedeWhenScoreIsClose() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("PHP", 100),
                KeywordCandidate.of("PHP Programming", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("PHP Programming");
    }

    @Test
    void deduplicate_shouldDropWeakLongerTerm() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Kafka", 100),
                KeywordCandidate.of("Kafka Streams", 60)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("Kafka");
    }

    @Test
    void deduplicate_shouldLetStrongShorterTermReplaceWeakLongerOne() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Spring Batch", 60),
                KeywordCandidate.of("Spring", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("Spring");
    }

    @Test
    void deduplicate_shouldAbsorbSeveralShorterTerms() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Spring", 100),
                KeywordCandidate.of("Boot", 80),
                KeywordCandidate.of("Spring Boot", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("Spring Boot");
    }

    @Test
    void deduplicate_shouldIgnoreContainmentOfTwoLetterTerms() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Go", 100),
                KeywordCandidate.of("Golang", 100)));

        assertThat(result).extracting(KeywordCandidate::getText).containsExactly("Go", "Golang");
    }

    @Test
    void deduplicate_shouldSortByScoreKeepingInputOrderOnTies() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("Vendor Onboarding", 60),
                KeywordCandidate.of("Scrum", 80),
                KeywordCandidate.of("Python", 100),
                KeywordCandidate.of("AWS", 100)));

        assertThat(result).extracting(KeywordCandidate::getText)
                .containsExactly("Python", "AWS", "Scrum", "Vendor Onboarding");
    }

    @Test
    void deduplicate_shouldLeaveNoSharedNormalizedForms() {
        List<KeywordCandidate> result = deduplicator.deduplicate(List.of(
                KeywordCandidate.of("CI/CD", 100),
                KeywordCandidate.of("cicd", 100),
                KeywordCandidate.of("Docker", 100),
                KeywordCandidate.of("docker", 100),
                KeywordCandidate.of("Docker Compose", 100),
                KeywordCandidate.of("SQL", 100),
                KeywordCandidate.of("PostgreSQL", 100)));

        assertThat(result).extracting(KeywordCandidate::getNormalizedForm).doesNotHaveDuplicates();
    }

    @Test
    void deduplicate_shouldReturnEmptyForEmptyInput() {
        assertThat(deduplicator.deduplicate(List.of())).isEmpty();
    }
}
