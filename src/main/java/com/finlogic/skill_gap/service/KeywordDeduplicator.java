package com.finlogic.skill_gap.service;

import com.finlogic.skill_gap.model.KeywordCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses near-duplicate keywords ("React.js" / "React", "PHP" / "PHP Programming")
 * into a single entry per normalized form.
 */
@Component
public class KeywordDeduplicator {

    public static final double OVERLAP_PREFERENCE = 0.7;

    static final int MIN_OVERLAP_LENGTH = 3;

    // single pass in input order; the stable sort keeps first-seen order among equal scores
    public List<KeywordCandidate> deduplicate(List<KeywordCandidate> scored) {
        Map<String, KeywordCandidate> kept = new LinkedHashMap<>();

        for (KeywordCandidate current : scored) {
            String normalized = current.getNormalizedForm();

            KeywordCandidate sameForm = kept.get(normalized);
            if (sameForm != null) {
                if (current.getImportanceScore() > sameForm.getImportanceScore()) {
                    kept.put(normalized, current);
                }
                continue;
            }

            boolean dropped = false;
            List<String> superseded = new ArrayList<>();

            for (Map.Entry<String, KeywordCandidate> entry : kept.entrySet()) {
                String existingNorm = entry.getKey();
                KeywordCandidate existing = entry.getValue();

                if (normalized.length() > existingNorm.length()) {
                    if (existingNorm.length() >= MIN_OVERLAP_LENGTH && normalized.contains(existingNorm)) {
                        // current is the more specific term; a longer term may absorb several shorter ones
                        if (current.getImportanceScore() >= OVERLAP_PREFERENCE * existing.getImportanceScore()) {
                            superseded.add(existingNorm);
                        } else {
                            dropped = true;
                            break;
                        }
                    }
                } else if (normalized.length() >= MIN_OVERLAP_LENGTH && existingNorm.contains(normalized)) {
                    if (existing.getImportanceScore() >= OVERLAP_PREFERENCE * current.getImportanceScore()) {
                        dropped = true;
                    } else {
                        superseded.add(existingNorm);
                    }
                    break;
                }
            }

            if (dropped) {
                continue;
            }
            for (String norm : superseded) {
                kept.remove(norm);
            }
            kept.put(normalized, current);
        }

        List<KeywordCandidate> result = new ArrayList<>(kept.values());
        result.sort(Comparator.comparingInt(KeywordCandidate::getImportanceScore).reversed());
        return result;
    }
}
