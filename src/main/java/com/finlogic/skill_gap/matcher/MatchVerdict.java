package com.finlogic.skill_gap.matcher;

/**
 * Outcome of a single rule in the matching cascade.
 */
public enum MatchVerdict {
    /** The pair is equivalent; stop evaluating. */
    MATCH,
    /** The pair is definitely not equivalent; stop evaluating. */
    NO_MATCH,
    /** The rule has no opinion; ask the next rule. */
    PASS
}
