package uk.gegc.pixelperfect.features.processing.infra.backend;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;

import java.util.Map;

/**
 * Transport to one family of processing backends.
 * {@link #call} may throw any runtime exception; callers normalise failures.
 */
public interface ImageBackend {

    ProviderKind providerKind();

    /**
     * Whether the backend can run the mode: upscaling modes need the upscale capability,
     * the others need enhance, and both needs the two.
     */
    default boolean supportsMode(BackendDescriptor backend, ProcessingMode mode) {
        return backend.hasAllCapabilities(mode.requiredCapabilities());
    }

    /**
     * Runs the model synchronously.
     *
     * @param input request body produced by the backend's input builder
     * @return raw model output, shape depends on the backend
     */
    Object call(BackendDescriptor backend, Map<String, Object> input);
}
