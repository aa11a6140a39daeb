package uk.gegc.pixelperfect.features.processing.infra.backend;

import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ImageBackendRegistry {

    private final Map<ProviderKind, ImageBackend> backends = new EnumMap<>(ProviderKind.class);

    public ImageBackendRegistry(List<ImageBackend> backends) {
        for (ImageBackend backend : backends) {
            this.backends.put(backend.providerKind(), backend);
        }
    }

    public ImageBackend backendFor(ProviderKind providerKind) {
        ImageBackend backend = backends.get(providerKind);
        if (backend == null) {
            throw new IllegalStateException("No image backend registered for provider " + providerKind);
        }
        return backend;
    }
}
