package com.finlogic.skill_gap.service;

import com.finlogic.skill_gap.model.KeywordCandidate;
import com.finlogic.skill_gap.model.KeywordExtractionResponse;
import com.finlogic.skill_gap.model.MatchResult;
import com.finlogic.skill_gap.util.SkillInputSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point of the skill-gap engine: compares the keywords extracted from a job
 * description with a candidate's skills. Performs no I/O and keeps no state between calls.
 */
@Service
public class SkillGapService {

    private static final Logger LOGGER = Logger.getLogger(SkillGapService.class.getName());

    public static final int MIN_KEYWORD_SCORE = ImportanceScorer.SCORE_MEDIUM;

    private final ImportanceScorer scorer;
    private final KeywordDeduplicator deduplicator;
    private final MatchResultAssembler assembler;

    @Autowired
    public SkillGapService(ImportanceScorer scorer, KeywordDeduplicator deduplicator, MatchResultAssembler assembler) {
        this.scorer = scorer;
        this.deduplicator = deduplicator;
        this.assembler = assembler;
    }

    public MatchResult analyze(Collection<?> jobDescriptionKeywords, Collection<?> userSkills) {
        List<String> skills = SkillInputSanitizer.sanitizeSkills(userSkills);
        List<KeywordCandidate> ranked = rankKeywords(jobDescriptionKeywords);
        LOGGER.fine("Matching " + skills.size() + " user skills against " + ranked.size() + " keywords");
        return assembler.assemble(ranked, skills);
    }

    public MatchResult analyze(KeywordExtractionResponse extraction, Collection<?> userSkills) {
        return analyze(KeywordExtractionResponse.keywordsOf(extraction), userSkills);
    }

    // highest score first
    public List<KeywordCandidate> rankKeywords(Collection<?> jobDescriptionKeywords) {
        List<String> keywords = SkillInputSanitizer.sanitizeKeywords(jobDescriptionKeywords);

        List<KeywordCandidate> scored = new ArrayList<>();
        for (String keyword : keywords) {
            int score = scorer.score(keyword);
            if (score >= MIN_KEYWORD_SCORE) {
                scored.add(KeywordCandidate.of(keyword, score));
            }
        }

        List<KeywordCandidate> ranked = deduplicator.deduplicate(scored);
        LOGGER.fine("Filtered to " + ranked.size() + " important keywords (from " + keywords.size()
                + " total, " + scored.size() + " scored, " + ranked.size() + " deduplicated)");
        return ranked;
    }
}
