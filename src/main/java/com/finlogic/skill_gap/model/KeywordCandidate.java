package com.finlogic.skill_gap.model;

import com.finlogic.skill_gap.util.SkillNormalizer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A job-description keyword together with its importance band.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class KeywordCandidate {
    private final String text;
    private final int importanceScore;
    private final String normalizedForm;

    public static KeywordCandidate of(String text, int importanceScore) {
        String safeText = text == null ? "" : text;
        return new KeywordCandidate(safeText, importanceScore, SkillNormalizer.normalize(safeText));
    }
}
