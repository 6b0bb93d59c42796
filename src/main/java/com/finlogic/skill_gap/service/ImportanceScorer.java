package com.finlogic.skill_gap.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Bands a keyword or skill into an importance score of 0, 30, 60, 80 or 100.
 * Higher means more specific and technical. Stateless.
 */
@Component
public class ImportanceScorer {

    public static final int SCORE_GENERIC = 0;
    public static final int SCORE_LOW = 30;
    public static final int SCORE_MEDIUM = 60;
    public static final int SCORE_HIGH = 80;
    public static final int SCORE_CRITICAL = 100;

    static final Set<String> GENERIC_TERMS = Set.of(
            "development", "developer", "engineering", "engineer",
            "experience", "knowledge", "understanding", "ability",
            "management", "manager", "work", "working",
            "design", "designer", "analysis", "analyst",
            "system", "systems", "application", "applications",
            "solution", "solutions", "process", "processes",
            "tool", "tools", "technology", "technologies",
            "platform", "platforms", "service", "services",
            "software", "hardware", "framework", "frameworks",
            "implementation", "deployment", "integration",
            "communication", "collaboration", "documentation", "presentation",
            "problem solving", "critical thinking", "team work", "teamwork",
            "leadership", "strategy", "planning", "organizational",
            "interpersonal", "analytical", "attention to detail",
            "multitasking", "time management", "self-motivated",
            "fast learner", "team player", "proactive");

    // languages, frameworks, cloud, databases, dev tooling, payments/compliance
    private static final List<Pattern> CRITICAL_PATTERNS = compile(
            "\\b(python|java|javascript|typescript|c\\+\\+|c#|ruby|php|go|rust|kotlin|swift|scala)\\b",
            "\\b(react|angular|vue|node\\.?js|django|flask|spring|express)\\b",
            "\\b(aws|azure|gcp|docker|kubernetes|terraform)\\b",
            "\\b(sql|mysql|postgresql|mongodb|redis|elasticsearch|oracle|rdbms)\\b",
            "\\b(git|github|gitlab|jira|jenkins|ci/cd)\\b",
            "\\b(tensorflow|pytorch|scikit-learn|pandas|numpy)\\b",
            "\\b(rest|graphql|api|microservices|host[- ]?to[- ]?host)\\b",
            "\\b(swift|iso\\s*20022|sepa|ach)\\b",
            "\\b(cash|cheque|electronic)\\s+(collection|collections)\\b",
            "\\b(supply\\s+chain|trade)\\s+finance\\b",
            "\\b(liquidity|cash|treasury)\\s+management\\b",
            "\\b(channel|core)\\s+banking\\b",
            "\\b(payment\\s+(processing|gateway)|wire\\s+transfer)\\b",
            "\\b(real[- ]time|instant)\\s+payments?\\b",
            "\\b(aml|kyc|fraud\\s+detection)\\b");

    // methodologies, BI, enterprise platforms, ML, business analysis, testing
    private static final List<Pattern> HIGH_PATTERNS = compile(
            "\\b(agile|scrum|kanban|devops|ci/cd)\\b",
            "\\b(tableau|power\\s*bi|looker|qlik)\\b",
            "\\b(salesforce|sap|oracle|workday)\\b",
            "\\b(machine learning|deep learning|ai|nlp|computer vision)\\b",
            "\\b(data\\s+analysis|data\\s+science|business\\s+analysis)\\b",
            "\\b(project\\s+management|product\\s+management)\\b",
            "\\b(fsd|frd|functional\\s+(specification|requirements?))\\b",
            "\\b(user\\s+stor(y|ies)|use\\s+case)\\b",
            "\\b(requirement|requirements)\\s+(traceability|gathering|elicitation)\\b",
            "\\b(elicitation|root[- ]cause\\s+analysis|rca)\\b",
            "\\b(defect|change)\\s+management\\b",
            "\\b(solution|functional|workflow)\\s+design\\b",
            "\\b(process\\s+(mapping|modeling|modelling))\\b",
            "\\b(flowchart|uml|bpmn)\\b",
            "\\b(stakeholder\\s+(management|engagement))\\b",
            "\\b(gap|fit[- ]gap)\\s+analysis\\b",
            "\\b(uat|sit|qa|quality\\s+assurance)\\b",
            "\\b(user\\s+acceptance|system\\s+integration|regression)\\s+testing\\b",
            "\\b(test\\s+(case|plan|strategy))\\b",
            "\\b(erp|crm|etl|esb)\\b",
            "\\b(system|data|application)\\s+integration\\b",
            "\\b(enterprise\\s+(resource\\s+planning|service\\s+bus))\\b");

    // first matching tier wins: blocklist, critical, high, multi-word, fallback
    public int score(String text) {
        String keyword = text == null ? "" : text;
        String lower = keyword.toLowerCase(Locale.ROOT);

        if (GENERIC_TERMS.contains(lower)) {
            return SCORE_GENERIC;
        }
        if (anyMatch(CRITICAL_PATTERNS, keyword)) {
            return SCORE_CRITICAL;
        }
        if (anyMatch(HIGH_PATTERNS, keyword)) {
            return SCORE_HIGH;
        }

        if (keyword.indexOf(' ') >= 0) {
            String trimmed = lower.trim();
            String[] words = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
            for (String word : words) {
                if (GENERIC_TERMS.contains(word)) {
                    return SCORE_GENERIC;
                }
            }
            if (words.length >= 2 && words.length <= 3) {
                return SCORE_MEDIUM;
            }
        }

        return SCORE_LOW;
    }

    private static boolean anyMatch(List<Pattern> patterns, String keyword) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(keyword).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        Pattern[] compiled = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            compiled[i] = Pattern.compile(regexes[i], Pattern.CASE_INSENSITIVE);
        }
        return List.of(compiled);
    }
}
