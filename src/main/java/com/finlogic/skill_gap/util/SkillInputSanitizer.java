package com.finlogic.skill_gap.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coerces loosely-typed request input (typically straight out of a JSON body) into clean lists.
 */
public final class SkillInputSanitizer {

    private SkillInputSanitizer() {
    }

    public static List<String> sanitizeSkills(Object raw) {
        List<String> skills = new ArrayList<>();
        if (!(raw instanceof Collection<?>)) {
            return skills;
        }
        for (Object entry : (Collection<?>) raw) {
            if (entry instanceof String) {
                String trimmed = ((String) entry).trim();
                if (!trimmed.isEmpty()) {
                    skills.add(trimmed);
                }
            }
        }
        return skills;
    }

    // duplicates are kept; null becomes ""
    public static List<String> sanitizeKeywords(Object raw) {
        List<String> keywords = new ArrayList<>();
        if (!(raw instanceof Collection<?>)) {
            return keywords;
        }
        for (Object entry : (Collection<?>) raw) {
            keywords.add(entry == null ? "" : String.valueOf(entry));
        }
        return keywords;
    }
}
