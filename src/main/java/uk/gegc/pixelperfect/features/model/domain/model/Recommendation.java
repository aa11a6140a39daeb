package uk.gegc.pixelperfect.features.model.domain.model;

import java.util.List;

public record Recommendation(
        String recommendedModel,
        String reasoning,
        long creditCost,
        List<String> alternatives,
        double confidence
) {

    public Recommendation {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
