package com.finlogic.skill_gap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of one skill-gap analysis. Counts and percentage always describe the
 * displayed lists, never the full keyword universe.
 */
@Getter
@ToString
@JsonPropertyOrder({"present_skills", "missing_skills", "match_percentage",
        "total_important_keywords", "present_count", "bifurcated"})
public class MatchResult {

    @JsonProperty("present_skills")
    private final List<String> presentSkills;

    @JsonProperty("missing_skills")
    private final List<String> missingSkills;

    @JsonProperty("match_percentage")
    private final int matchPercentage;

    @JsonProperty("total_important_keywords")
    private final int totalDisplayed;

    @JsonProperty("present_count")
    private final int presentCount;

    public MatchResult(List<String> presentSkills, List<String> missingSkills) {
        this.presentSkills = List.copyOf(presentSkills);
        this.missingSkills = List.copyOf(missingSkills);
        this.presentCount = this.presentSkills.size();
        this.totalDisplayed = this.presentCount + this.missingSkills.size();
        this.matchPercentage = totalDisplayed > 0
                ? (int) Math.round(100.0 * presentCount / totalDisplayed)
                : 0;
    }

    public static MatchResult empty() {
        return new MatchResult(List.of(), List.of());
    }

    // kept for clients that read this flag; the lists are never split by weight
    @JsonProperty("bifurcated")
    public boolean isBifurcated() {
        return false;
    }
}
