package com.finlogic.skill_gap.util;

import java.util.List;
import java.util.Locale;

/**
 * Pure string helpers shared by the scorer, the deduplicator and the matcher.
 */
public final class SkillNormalizer {

    public static final String FAMILY_SQL = "sql";
    public static final String FAMILY_NOSQL = "nosql";

    private static final List<String> NOSQL_ENGINES = List.of(
            "mongodb", "cassandra", "dynamodb", "couchbase", "cosmosdb",
            "elasticsearch", "elastic", "firebase", "firestore", "redis");

    private static final List<String> SQL_ENGINES = List.of(
            "mysql", "mssql", "sqlserver", "postgresql", "postgres", "postgre", "pgsql",
            "tsql", "plsql", "mariadb", "sqlite", "redshift", "snowflake", "synapse",
            "bigquery", "aurora", "aurorasql", "db2", "teradata", "vertica", "hana");

    private SkillNormalizer() {
    }

    /**
     * Lowercases the text and drops every character outside {@code [a-z0-9]}.
     * A null input is treated as the empty string.
     *
     * @param text raw keyword or skill
     * @return normalized form, never null
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Classifies a normalized value into the "sql" or "nosql" technology family.
     * Values outside both families come back unchanged.
     *
     * @param normalized a value produced by {@link #normalize(String)}
     * @return {@link #FAMILY_NOSQL}, {@link #FAMILY_SQL} or the input itself
     */
    public static String familyOf(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return normalized;
        }

        // nosql first, otherwise "nosql".endsWith("sql") would land it in the sql family
        if (normalized.contains(FAMILY_NOSQL)) {
            return FAMILY_NOSQL;
        }
        for (String engine : NOSQL_ENGINES) {
            if (normalized.contains(engine)) {
                return FAMILY_NOSQL;
            }
        }

        if (normalized.startsWith(FAMILY_SQL) || normalized.endsWith(FAMILY_SQL)) {
            return FAMILY_SQL;
        }
        for (String engine : SQL_ENGINES) {
            if (normalized.contains(engine)) {
                return FAMILY_SQL;
            }
        }

        return normalized;
    }

    public static boolean hasFamily(String normalized) {
        String family = familyOf(normalized);
        return FAMILY_SQL.equals(family) || FAMILY_NOSQL.equals(family);
    }
}
