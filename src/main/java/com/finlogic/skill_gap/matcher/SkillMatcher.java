package com.finlogic.skill_gap.matcher;

import org.springframework.util.Assert;

import java.util.List;

/**
 * Decides whether a normalized user skill and a normalized keyword name the same thing,
 * by walking an ordered list of {@link MatchRule}s. The first rule that returns
 * {@link MatchVerdict#MATCH} or {@link MatchVerdict#NO_MATCH} settles it.
 */
public class SkillMatcher {

    private final List<MatchRule> rules;

    public SkillMatcher(List<MatchRule> rules) {
        Assert.notEmpty(rules, "Matcher needs at least one rule");
        this.rules = List.copyOf(rules);
    }

    public SkillMatcher() {
        this(MatchRules.defaultCascade());
    }

    public boolean matches(String normalizedSkill, String normalizedKeyword) {
        return verdict(normalizedSkill, normalizedKeyword) == MatchVerdict.MATCH;
    }

    /**
     * @return the rule that settled the pair, or null if every rule passed
     */
    public MatchRule decidingRule(String normalizedSkill, String normalizedKeyword) {
        return firstDecisive(orEmpty(normalizedSkill), orEmpty(normalizedKeyword));
    }

    public MatchVerdict verdict(String normalizedSkill, String normalizedKeyword) {
        String skill = orEmpty(normalizedSkill);
        String keyword = orEmpty(normalizedKeyword);
        MatchRule rule = firstDecisive(skill, keyword);
        return rule == null ? MatchVerdict.NO_MATCH : rule.evaluate(skill, keyword);
    }

    public List<MatchRule> getRules() {
        return rules;
    }

    private MatchRule firstDecisive(String skill, String keyword) {
        for (MatchRule rule : rules) {
            if (rule.evaluate(skill, keyword) != MatchVerdict.PASS) {
                return rule;
            }
        }
        return null;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
