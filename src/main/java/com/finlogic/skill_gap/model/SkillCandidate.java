package com.finlogic.skill_gap.model;

import com.finlogic.skill_gap.util.SkillNormalizer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A user-reported skill, normalized and scored once.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SkillCandidate {
    private final String text;
    private final String normalizedForm;
    private final int importanceScore;

    public static SkillCandidate of(String text, int importanceScore) {
        String safeText = text == null ? "" : text;
        return new SkillCandidate(safeText, SkillNormalizer.normalize(safeText), importanceScore);
    }
}
