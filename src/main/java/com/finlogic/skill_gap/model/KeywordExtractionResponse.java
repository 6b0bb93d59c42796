package com.finlogic.skill_gap.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Payload returned by the keyword extraction service ({@code {"keywords": [...]}}).
 * Extra fields the service adds are ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeywordExtractionResponse {
    // left untyped so a non-array value still binds instead of failing the whole payload
    private Object keywords;

    public static List<Object> keywordsOf(KeywordExtractionResponse response) {
        if (response == null || !(response.getKeywords() instanceof Collection<?>)) {
            return List.of();
        }
        // entries may be null, so List.copyOf is not an option
        return Collections.unmodifiableList(new ArrayList<>((Collection<?>) response.getKeywords()));
    }
}
