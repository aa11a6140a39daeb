package uk.gegc.pixelperfect.features.processing.infra.input;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.domain.exception.InvalidCatalogException;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.processing.infra.input.builders.GfpganInputBuilder;
import uk.gegc.pixelperfect.features.processing.infra.input.builders.RealEsrganInputBuilder;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;
import static uk.gegc.pixelperfect.features.model.TestBackends.upscaler;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModelInputBuilderRegistry")
class ModelInputBuilderRegistryTest {

    @Mock
    private ModelCatalog modelCatalog;

    @Test
    @DisplayName("resolves builders by backend id")
    void lookup() {
        when(modelCatalog.listEnabled()).thenReturn(List.of(
                upscaler("real-esrgan", "0.002", "1", 7.0, Set.of(2, 4), SubscriptionTier.FREE)));
        ModelInputBuilderRegistry registry = new ModelInputBuilderRegistry(
                List.of(new RealEsrganInputBuilder(), new GfpganInputBuilder()), modelCatalog);

        registry.verifyCoverage();

        assertThat(registry.builderFor("real-esrgan")).isInstanceOf(RealEsrganInputBuilder.class);
        assertThat(registry.builderFor("gfpgan")).isInstanceOf(GfpganInputBuilder.class);
    }

    @Test
    @DisplayName("an enabled backend without a builder fails startup")
    void missingBuilder() {
        when(modelCatalog.listEnabled()).thenReturn(List.of(
                upscaler("real-esrgan", "0.002", "1", 7.0, Set.of(2, 4), SubscriptionTier.FREE),
                upscaler("mystery", "0.01", "1", 8.0, Set.of(2), SubscriptionTier.FREE)));
        ModelInputBuilderRegistry registry =
                new ModelInputBuilderRegistry(List.of(new RealEsrganInputBuilder()), modelCatalog);

        assertThatThrownBy(registry::verifyCoverage)
                .isInstanceOf(InvalidCatalogException.class)
                .hasMessageContaining("mystery");
    }

    @Test
    @DisplayName("two builders for one backend are rejected")
    void duplicateBuilder() {
        assertThatThrownBy(() -> new ModelInputBuilderRegistry(
                List.of(new RealEsrganInputBuilder(), new RealEsrganInputBuilder()), modelCatalog))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("unknown ids fail fast")
    void unknownId() {
        ModelInputBuilderRegistry registry = new ModelInputBuilderRegistry(List.of(), modelCatalog);

        assertThatThrownBy(() -> registry.builderFor("nope")).isInstanceOf(IllegalStateException.class);
    }
}
