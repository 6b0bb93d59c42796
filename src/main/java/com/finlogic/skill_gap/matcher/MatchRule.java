package com.finlogic.skill_gap.matcher;

/**
 * One step of the skill/keyword equivalence cascade. Both arguments are normalized
 * (lowercase alphanumeric) and never null.
 */
public interface MatchRule {

    String name();

    MatchVerdict evaluate(String skill, String keyword);
}
