package com.finlogic.skill_gap.matcher;

import com.finlogic.skill_gap.util.SkillNormalizer;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

import static java.util.Map.entry;

/**
 * The rules of the skill/keyword equivalence cascade and the lookup tables behind them.
 * Narrow rules come before the broad substring rule; {@link #defaultCascade()} fixes that order.
 */
public final class MatchRules {

    static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            entry("js", "javascript"),
            entry("ts", "typescript"),
            entry("py", "python"),
            entry("rb", "ruby"),
            entry("cs", "csharp"),
            entry("c#", "csharp"),
            entry("cpp", "cplusplus"),
            entry("c++", "cplusplus"),
            entry("ml", "machinelearning"),
            entry("ai", "artificialintelligence"),
            entry("nlp", "naturallanguageprocessing"),
            entry("bi", "businessintelligence"),
            entry("ci", "continuousintegration"),
            entry("cd", "continuousdeployment"),
            entry("cicd", "continuousintegration"),
            entry("rdbms", "relationaldatabase"),
            entry("nosql", "nosql"),
            entry("ux", "userinterface"),
            entry("ui", "userinterface"),
            entry("qa", "qualityassurance"),
            entry("uat", "useracceptancetesting"),
            entry("sit", "systemintegrationtesting"),
            entry("sql", "sql"),
            entry("php", "php"),
            entry("html", "html"),
            entry("css", "css"),
            entry("mssql", "sql"),
            entry("mysql", "sql"),
            entry("postgresql", "sql"),
            entry("mongodb", "nosql"),
            entry("cassandra", "nosql"),
            entry("dynamodb", "nosql"));

    // ecosystem terms that are not abbreviations of each other but count as the same capability
    static final Map<String, String> CAPABILITY_FAMILIES = Map.ofEntries(
            entry("agilemethodologies", "agile"),
            entry("agile", "agile"),
            entry("cicd", "devops"),
            entry("continuousintegration", "devops"),
            entry("continuousdeployment", "devops"),
            entry("devops", "devops"),
            entry("docker", "containers"),
            entry("container", "containers"),
            entry("kubernetes", "containers"),
            entry("k8s", "containers"),
            entry("restfulapis", "restfulapis"),
            entry("restapi", "restfulapis"),
            entry("restapis", "restfulapis"),
            entry("api", "restfulapis"),
            entry("javascript", "javascript"),
            entry("js", "javascript"),
            entry("typescript", "javascript"),
            entry("aspnet", "aspnet"),
            entry("aspdotnet", "aspnet"),
            entry("net", "aspnet"),
            entry("dotnet", "aspnet"),
            entry("csharp", "csharp"),
            entry("c#", "csharp"),
            entry("vb", "csharp"),
            entry("sql", "sql"),
            entry("mssql", "sql"),
            entry("nosql", "nosql"),
            entry("mongodb", "nosql"),
            entry("github", "github"),
            entry("git", "github"));

    static final List<String> GENERIC_SUFFIXES = List.of(
            "programming", "development", "design", "management", "testing", "analysis", "engineering");

    static final Set<String> TWO_LETTER_TECH_TERMS = Set.of(
            "js", "ts", "py", "rb", "go", "ai", "ml", "bi", "ci", "cd", "ux", "ui", "qa", "sql");

    static final Set<String> JS_FRAMEWORKS = Set.of("react", "angular", "vue", "next", "nextjs");

    static final int MIN_TERM_LENGTH = 2;
    static final int MIN_BASE_LENGTH = 3;
    static final int MIN_CONTAINED_LENGTH = 3;
    static final double LENGTH_GAP_FACTOR = 1.5;
    static final double LOOSE_WORD_RATIO = 0.7;
    static final int LONG_TERM_LENGTH = 8;
    static final double LONG_TERM_RATIO = 0.6;
    static final double SHORT_TERM_RATIO = 0.5;
    static final int SHORT_TERM_MIN_LENGTH = 4;
    static final int CROSS_CHECK_MAX_LENGTH_DIFF = 3;

    public static final MatchRule EXACT = rule("exact", (skill, keyword) ->
            skill.equals(keyword) ? MatchVerdict.MATCH : MatchVerdict.PASS);

    public static final MatchRule TOO_SHORT = rule("too-short", (skill, keyword) ->
            skill.length() < MIN_TERM_LENGTH || keyword.length() < MIN_TERM_LENGTH
                    ? MatchVerdict.NO_MATCH
                    : MatchVerdict.PASS);

    public static final MatchRule ABBREVIATION = rule("abbreviation", (skill, keyword) ->
            abbreviate(skill).equals(abbreviate(keyword)) ? MatchVerdict.MATCH : MatchVerdict.PASS);

    public static final MatchRule CAPABILITY_FAMILY = rule("capability-family", (skill, keyword) -> {
        String skillCapability = capabilityOf(skill);
        String keywordCapability = capabilityOf(keyword);
        if (skillCapability.equals(keywordCapability)
                || skillCapability.equals(abbreviate(keyword))
                || keywordCapability.equals(abbreviate(skill))) {
            return MatchVerdict.MATCH;
        }
        return MatchVerdict.PASS;
    });

    public static final MatchRule BASE_WORD = rule("base-word", (skill, keyword) -> {
        String skillBase = stripSuffix(skill);
        return skillBase.length() >= MIN_BASE_LENGTH && skillBase.equals(stripSuffix(keyword))
                ? MatchVerdict.MATCH
                : MatchVerdict.PASS;
    });

    public static final MatchRule CONTAINMENT = rule("containment", MatchRules::containment);

    public static final MatchRule ABBREVIATION_CROSS_CHECK = rule("abbreviation-cross-check", (skill, keyword) ->
            (abbreviate(skill).contains(keyword) || abbreviate(keyword).contains(skill))
                    && Math.abs(skill.length() - keyword.length()) <= CROSS_CHECK_MAX_LENGTH_DIFF
                    ? MatchVerdict.MATCH
                    : MatchVerdict.PASS);

    public static final MatchRule JS_FRAMEWORK = rule("js-framework", (skill, keyword) ->
            (JS_FRAMEWORKS.contains(skill) && mentionsJavascriptOrFramework(keyword))
                    || (JS_FRAMEWORKS.contains(keyword) && mentionsJavascriptOrFramework(skill))
                    ? MatchVerdict.MATCH
                    : MatchVerdict.PASS);

    public static final MatchRule DOTNET = rule("dotnet", (skill, keyword) ->
            isDotnet(skill) && isDotnet(keyword) ? MatchVerdict.MATCH : MatchVerdict.PASS);

    public static final MatchRule CSHARP_VB = rule("csharp-vb", (skill, keyword) ->
            (skill.equals("csharp") || skill.equals("c#"))
                    && (keyword.equals("csharp") || keyword.equals("c#") || keyword.contains("vb"))
                    ? MatchVerdict.MATCH
                    : MatchVerdict.PASS);

    public static final MatchRule TECHNOLOGY_FAMILY = rule("technology-family", (skill, keyword) -> {
        String family = SkillNormalizer.familyOf(skill);
        return SkillNormalizer.hasFamily(skill) && family.equals(SkillNormalizer.familyOf(keyword))
                ? MatchVerdict.MATCH
                : MatchVerdict.PASS;
    });

    private MatchRules() {
    }

    /**
     * @return the production cascade, in evaluation order
     */
    public static List<MatchRule> defaultCascade() {
        return List.of(
                EXACT,
                TOO_SHORT,
                ABBREVIATION,
                CAPABILITY_FAMILY,
                BASE_WORD,
                CONTAINMENT,
                ABBREVIATION_CROSS_CHECK,
                JS_FRAMEWORK,
                DOTNET,
                CSHARP_VB,
                TECHNOLOGY_FAMILY);
    }

    static String abbreviate(String normalized) {
        return ABBREVIATIONS.getOrDefault(normalized, normalized);
    }

    static String capabilityOf(String normalized) {
        return CAPABILITY_FAMILIES.getOrDefault(normalized, normalized);
    }

    static String stripSuffix(String normalized) {
        for (String suffix : GENERIC_SUFFIXES) {
            if (normalized.endsWith(suffix)) {
                return normalized.substring(0, normalized.length() - suffix.length()).trim();
            }
        }
        return normalized;
    }

    /**
     * Substring containment gated by relative length. Decisive once containment holds:
     * a contained but too-short term is rejected outright rather than handed to later rules.
     */
    static MatchVerdict containment(String skill, String keyword) {
        String longer = skill.length() >= keyword.length() ? skill : keyword;
        String shorter = skill.length() < keyword.length() ? skill : keyword;

        if (!longer.contains(shorter)) {
            return MatchVerdict.PASS;
        }
        if (shorter.length() < MIN_CONTAINED_LENGTH && !TWO_LETTER_TECH_TERMS.contains(shorter)) {
            return MatchVerdict.NO_MATCH;
        }

        double ratio = (double) shorter.length() / longer.length();
        boolean matched;
        if (longer.length() > shorter.length() * LENGTH_GAP_FACTOR) {
            matched = containsWholeWord(longer, shorter) || ratio >= LOOSE_WORD_RATIO;
        } else if (longer.length() > LONG_TERM_LENGTH) {
            matched = ratio >= LONG_TERM_RATIO;
        } else {
            matched = ratio >= SHORT_TERM_RATIO || shorter.length() >= SHORT_TERM_MIN_LENGTH;
        }
        return matched ? MatchVerdict.MATCH : MatchVerdict.NO_MATCH;
    }

    private static boolean containsWholeWord(String text, String word) {
        return Arrays.asList(text.split("\\s+")).contains(word);
    }

    private static boolean mentionsJavascriptOrFramework(String normalized) {
        return normalized.contains("javascript") || normalized.contains("framework");
    }

    private static boolean isDotnet(String normalized) {
        return normalized.contains("aspnet") || normalized.contains("net") || normalized.equals("dotnet");
    }

    private static MatchRule rule(String name, BiFunction<String, String, MatchVerdict> body) {
        return new MatchRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public MatchVerdict evaluate(String skill, String keyword) {
                return body.apply(skill, keyword);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
