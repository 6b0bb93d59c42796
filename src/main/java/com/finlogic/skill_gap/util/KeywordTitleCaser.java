package com.finlogic.skill_gap.util;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Turns a keyword into its display form. Acronyms and branded terms come from a curated
 * table; everything else gets its first letter of each word capitalized.
 */
public final class KeywordTitleCaser {

    private static final Map<String, String> SPECIAL_CASES = Map.ofEntries(
            // Languages and runtimes
            entry("c++", "C++"),
            entry("c#", "C#"),
            entry(".net", ".NET"),
            entry("node.js", "Node.js"),
            entry("next.js", "Next.js"),
            entry("react.js", "React.js"),
            entry("vue.js", "Vue.js"),
            entry("angular.js", "Angular.js"),
            entry("express.js", "Express.js"),

            // Cloud
            entry("aws", "AWS"),
            entry("gcp", "GCP"),
            entry("ec2", "EC2"),
            entry("s3", "S3"),

            // Databases
            entry("sql", "SQL"),
            entry("nosql", "NoSQL"),
            entry("mysql", "MySQL"),
            entry("postgresql", "PostgreSQL"),
            entry("mongodb", "MongoDB"),
            entry("t-sql", "T-SQL"),
            entry("pl/sql", "PL/SQL"),
            entry("rdbms", "RDBMS"),

            // BI and analytics
            entry("power bi", "Power BI"),
            entry("kpi", "KPI"),
            entry("kpis", "KPIs"),
            entry("roi", "ROI"),
            entry("return on investment", "Return on Investment"),

            // Web
            entry("api", "API"),
            entry("rest", "REST"),
            entry("graphql", "GraphQL"),
            entry("html", "HTML"),
            entry("css", "CSS"),
            entry("json", "JSON"),
            entry("xml", "XML"),
            entry("ui", "UI"),
            entry("ux", "UX"),
            entry("ui/ux", "UI/UX"),

            // DevOps
            entry("ci/cd", "CI/CD"),
            entry("k8s", "K8s"),

            // AI/ML
            entry("ai", "AI"),
            entry("ml", "ML"),
            entry("ai/ml", "AI/ML"),
            entry("nlp", "NLP"),
            entry("llm", "LLM"),
            entry("generative ai", "Generative AI"),

            // Certifications
            entry("pmp", "PMP"),
            entry("csm", "CSM"),
            entry("itil", "ITIL"),

            // Banking and payments
            entry("swift", "SWIFT"),
            entry("iso20022", "ISO20022"),
            entry("iso 20022", "ISO 20022"),
            entry("aml", "AML"),
            entry("kyc", "KYC"),
            entry("sepa", "SEPA"),
            entry("ach", "ACH"),
            entry("host-to-host", "Host-to-Host"),
            entry("host to host", "Host-to-Host"),
            entry("real-time payments", "Real-Time Payments"),
            entry("anti-money laundering", "Anti-Money Laundering"),

            // Business analysis
            entry("fsd", "FSD"),
            entry("frd", "FRD"),
            entry("root-cause analysis", "Root-Cause Analysis"),
            entry("root cause analysis", "Root-Cause Analysis"),
            entry("rca", "RCA"),
            entry("uml diagrams", "UML Diagrams"),
            entry("uml", "UML"),
            entry("bpmn", "BPMN"),
            entry("fit-gap analysis", "Fit-Gap Analysis"),

            // Enterprise systems
            entry("erp", "ERP"),
            entry("crm", "CRM"),
            entry("etl", "ETL"),
            entry("esb", "ESB"),

            // Testing
            entry("uat", "UAT"),
            entry("sit", "SIT"),
            entry("qa", "QA")
    );

    private KeywordTitleCaser() {
    }

    public static String titleize(String input) {
        if (input == null) {
            return "";
        }
        String lower = input.toLowerCase(Locale.ROOT).trim();
        if (lower.isEmpty()) {
            return "";
        }

        String whole = SPECIAL_CASES.get(lower);
        if (whole != null) {
            return whole;
        }

        String[] words = lower.split("\\s+");
        StringBuilder sb = new StringBuilder(lower.length());
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            String special = SPECIAL_CASES.get(word);
            if (special != null) {
                sb.append(special);
            } else {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.toString();
    }
}
