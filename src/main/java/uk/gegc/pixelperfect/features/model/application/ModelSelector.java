package uk.gegc.pixelperfect.features.model.application;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.SelectionCriteria;

import java.util.Optional;

public interface ModelSelector {

    /**
     * Picks the backend best matching the criteria.
     *
     * <p>Tier, required capabilities and scale are hard filters. Face enhancement is a soft preference that
     * only narrows the candidates when at least one backend survives it. Candidates are ranked by quality
     * (when quality is prioritised) or by cost, and the first affordable one wins. When none is affordable
     * the cheapest candidate is still returned; the debit rejects it later if the balance really is short.
     *
     * @return empty only when no backend passes the hard filters
     */
    Optional<BackendDescriptor> selectBest(SelectionCriteria criteria);
}
