package com.finlogic.skill_gap.service;

import com.finlogic.skill_gap.matcher.MatchRule;
import com.finlogic.skill_gap.matcher.SkillMatcher;
import com.finlogic.skill_gap.model.KeywordCandidate;
import com.finlogic.skill_gap.model.MatchResult;
import com.finlogic.skill_gap.model.SkillCandidate;
import com.finlogic.skill_gap.util.KeywordTitleCaser;
import com.finlogic.skill_gap.util.SkillNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Greedily pairs user skills with ranked keywords and builds the capped present/missing lists.
 */
@Component
public class MatchResultAssembler {

    private static final Logger LOGGER = Logger.getLogger(MatchResultAssembler.class.getName());

    public static final int MIN_SKILL_SCORE = ImportanceScorer.SCORE_LOW;
    public static final int MAX_PRESENT_SKILLS = 15;

    static final int STRONG_MATCH_COUNT = 6;
    static final int MODERATE_MATCH_COUNT = 3;

    private final ImportanceScorer scorer;
    private final SkillMatcher matcher;
    private final boolean verboseLogging;

    public MatchResultAssembler(ImportanceScorer scorer,
                                SkillMatcher matcher,
                                @Value("${skill-gap.logging.verbose:false}") boolean verboseLogging) {
        Assert.notNull(scorer, "ImportanceScorer must not be null");
        Assert.notNull(matcher, "SkillMatcher must not be null");
        this.scorer = scorer;
        this.matcher = matcher;
        this.verboseLogging = verboseLogging;
    }

    /**
     * @param rankedKeywords deduplicated keywords, highest score first
     * @param userSkills     sanitized user skills, in input order
     */
    public MatchResult assemble(List<KeywordCandidate> rankedKeywords, List<String> userSkills) {
        if (rankedKeywords.isEmpty()) {
            logSummary(MatchResult.empty());
            return MatchResult.empty();
        }

        boolean[] consumed = new boolean[rankedKeywords.size()];
        List<KeywordCandidate> matched = new ArrayList<>();

        for (String raw : userSkills) {
            SkillCandidate skill = SkillCandidate.of(raw, scorer.score(raw));
            // generic skills like "Teamwork" never count as a match
            if (skill.getImportanceScore() < MIN_SKILL_SCORE) {
                continue;
            }

            for (int i = 0; i < rankedKeywords.size(); i++) {
                if (consumed[i]) {
                    continue;
                }
                KeywordCandidate keyword = rankedKeywords.get(i);
                if (matcher.matches(skill.getNormalizedForm(), keyword.getNormalizedForm())) {
                    consumed[i] = true;
                    matched.add(keyword);
                    if (LOGGER.isLoggable(Level.FINE)) {
                        MatchRule rule = matcher.decidingRule(skill.getNormalizedForm(), keyword.getNormalizedForm());
                        LOGGER.fine("Skill [" + skill.getText() + "] matched keyword [" + keyword.getText() + "] via " + rule);
                    }
                    break;
                }
            }
        }

        int matchedCount = matched.size();
        matched.sort(Comparator.comparingInt(KeywordCandidate::getImportanceScore).reversed());

        List<String> present = new ArrayList<>();
        Set<String> presentNormalized = new HashSet<>();
        for (KeywordCandidate keyword : matched) {
            String display = KeywordTitleCaser.titleize(keyword.getText());
            if (presentNormalized.add(SkillNormalizer.normalize(display))) {
                present.add(display);
            }
            if (present.size() == MAX_PRESENT_SKILLS) {
                break;
            }
        }

        List<String> capped = new ArrayList<>();
        int maxMissing = maxMissingFor(matchedCount);
        for (int i = 0; i < rankedKeywords.size() && capped.size() < maxMissing; i++) {
            KeywordCandidate keyword = rankedKeywords.get(i);
            if (consumed[i]) {
                continue;
            }
            // with many matches only the critical gaps are worth showing
            if (matchedCount >= STRONG_MATCH_COUNT && keyword.getImportanceScore() != ImportanceScorer.SCORE_CRITICAL) {
                continue;
            }
            capped.add(KeywordTitleCaser.titleize(keyword.getText()));
        }

        List<String> missing = new ArrayList<>(capped.size());
        for (String display : capped) {
            if (presentNormalized.contains(SkillNormalizer.normalize(display))) {
                LOGGER.warning("Removing duplicate keyword from missing: " + display + " (already in present)");
                continue;
            }
            missing.add(display);
        }

        MatchResult result = new MatchResult(present, missing);
        logSummary(result);
        return result;
    }

    /**
     * Missing-list cap keyed on how many skills matched.
     */
    public static int maxMissingFor(int matchedCount) {
        if (matchedCount >= STRONG_MATCH_COUNT) {
            return 4;
        } else if (matchedCount >= MODERATE_MATCH_COUNT) {
            return 6;
        } else {
            return 10;
        }
    }

    private void logSummary(MatchResult result) {
        Level level = verboseLogging ? Level.INFO : Level.FINE;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, "Summary: " + result.getPresentCount() + " present, "
                    + result.getMissingSkills().size() + " missing, "
                    + result.getTotalDisplayed() + " total, "
                    + result.getMatchPercentage() + "% match");
        }
    }
}
