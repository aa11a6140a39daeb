package uk.gegc.pixelperfect.features.processing.infra.input;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;

import java.util.Map;

/**
 * Translates the canonical input into the request body one specific backend expects.
 * Implementations are pure: no I/O, no shared state.
 */
public interface ModelInputBuilder {

    /**
     * Catalog id of the backend this builder serves.
     */
    String backendId();

    Map<String, Object> build(ImageInput input, BackendDescriptor backend);

    /**
     * Largest supported scale not above the requested one, or the smallest supported scale.
     */
    static int clampScale(int requested, BackendDescriptor backend) {
        int best = -1;
        int smallest = Integer.MAX_VALUE;
        for (int scale : backend.supportedScales()) {
            smallest = Math.min(smallest, scale);
            if (scale <= requested && scale > best) {
                best = scale;
            }
        }
        if (best > 0) {
            return best;
        }
        return smallest == Integer.MAX_VALUE ? requested : smallest;
    }
}
