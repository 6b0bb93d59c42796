package com.finlogic.skill_gap.service;

import com.finlogic.skill_gap.matcher.SkillMatcher;
import com.finlogic.skill_gap.model.KeywordCandidate;
import com.finlogic.skill_gap.model.KeywordExtractionResponse;
import com.finlogic.skill_gap.model.MatchResult;
import com.finlogic.skill_gap.util.SkillNormalizer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SkillGapServiceTest {

    private final ImportanceScorer scorer = new ImportanceScorer();
    private final SkillGapService service = new SkillGapService(
            scorer,
            new KeywordDeduplicator(),
            new MatchResultAssembler(scorer, new SkillMatcher(), false));

    @Test
    void analyze_shouldFilterGenericTermsAndReportRemainingGaps() {
        MatchResult result = service.analyze(
                List.of("Python", "Communication", "SQL", "AWS"),
                List.of("Python", "Teamwork"));

        assertThat(result.getPresentSkills()).containsExactly("Python");
        assertThat(result.getMissingSkills()).containsExactly("SQL", "AWS");
        assertThat(result.getMatchPercentage()).isEqualTo(33);
        assertThat(result.getTotalDisplayed()).isEqualTo(3);
        assertThat(result.getPresentCount()).isEqualTo(1);
    }

    @Test
    void analyze_shouldMergeFrameworkVariantsIntoOnePresentEntry() {
        MatchResult result = service.analyze(
                List.of("React.js", "React", "JavaScript"),
                List.of("React"));

        assertThat(result.getPresentSkills()).containsExactly("React.js");
        assertThat(result.getMissingSkills()).containsExactly("Javascript");
        assertThat(result.getMatchPercentage()).isEqualTo(50);
    }

    @Test
    void analyze_shouldReturnEmptyResultWithoutKeywords() {
        MatchResult result = service.analyze(List.of(), List.of("Python", "SQL"));

        assertThat(result.getPresentSkills()).isEmpty();
        assertThat(result.getMissingSkills()).isEmpty();
        assertThat(result.getMatchPercentage()).isZero();
        assertThat(result.getTotalDisplayed()).isZero();
    }

    @Test
    void analyze_shouldTolerateNullAndMalformedInput() {
        MatchResult nothing = service.analyze((Collection<?>) null, null);
        assertThat(nothing.getTotalDisplayed()).isZero();

        MatchResult result = service.analyze(
                Arrays.asList("Python", null, 42, "Kubernetes"),
                Arrays.asList("python", 7, null, "  "));

        assertThat(result.getPresentSkills()).containsExactly("Python");
        assertThat(result.getMissingSkills()).containsExactly("Kubernetes");
    }

    @Test
    void analyze_shouldReadKeywordsFromExtractionPayload() {
        MatchResult result = service.analyze(
                new KeywordExtractionResponse(List.of("Python", "SQL")),
                List.of("python"));

        assertThat(result.getPresentSkills()).containsExactly("Python");
        assertThat(result.getMissingSkills()).containsExactly("SQL");
    }

    @Test
    void analyze_shouldDegradeMissingExtractionPayloadToEmptyResult() {
        assertThat(service.analyze((KeywordExtractionResponse) null, List.of("Python")).getTotalDisplayed()).isZero();
        assertThat(service.analyze(new KeywordExtractionResponse(), List.of("Python")).getTotalDisplayed()).isZero();
    }

    @Test
    void analyze_shouldDegradeNonArrayExtractionKeywordsToEmptyResult() {
        MatchResult result = service.analyze(new KeywordExtractionResponse("Python, SQL"), List.of("Python"));

        assertThat(result.getPresentSkills()).isEmpty();
        assertThat(result.getMissingSkills()).isEmpty();
        assertThat(result.getMatchPercentage()).isZero();
    }

    @Test
    void rankKeywords_shouldScoreFilterAndDeduplicate() {
        List<KeywordCandidate> ranked = service.rankKeywords(
                List.of("Python", "python", "Communication", "PHP", "PHP Programming", "Agile", "Figma"));

        assertThat(ranked).extracting(KeywordCandidate::getText).containsExactly("Python", "PHP Programming", "Agile");
        assertThat(ranked).extracting(KeywordCandidate::getImportanceScore).containsExactly(100, 100, 80);
    }

    @Test
    void analyze_shouldKeepDisplayedListsConsistent() {
        MatchResult result = service.analyze(
                List.of("Java", "Spring Boot", "Microservices", "Kafka", "AWS", "Docker", "Kubernetes",
                        "SQL", "PostgreSQL", "Agile", "Communication", "Payment Processing", "KYC",
                        "CI/CD", "REST APIs", "Customer Onboarding"),
                List.of("Java", "Spring", "Docker", "MySQL", "Teamwork", "Git", "Scrum"));

        Set<String> present = result.getPresentSkills().stream()
                .map(SkillNormalizer::normalize)
                .collect(Collectors.toSet());
        Set<String> missing = result.getMissingSkills().stream()
                .map(SkillNormalizer::normalize)
                .collect(Collectors.toSet());

        assertThat(present).doesNotContainAnyElementsOf(missing);
        assertThat(result.getPresentSkills()).doesNotHaveDuplicates().hasSizeLessThanOrEqualTo(15);
        assertThat(result.getTotalDisplayed()).isEqualTo(result.getPresentCount() + result.getMissingSkills().size());
        assertThat(result.getMatchPercentage())
                .isBetween(0, 100)
                .isEqualTo((int) Math.round(100.0 * result.getPresentCount() / result.getTotalDisplayed()));
    }
}
