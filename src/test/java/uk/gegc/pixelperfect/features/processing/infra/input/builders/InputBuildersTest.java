package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.processing.domain.model.EnhancementSettings;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;
import uk.gegc.pixelperfect.features.processing.infra.input.PromptBuilder;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.pixelperfect.features.model.TestBackends.enhancer;
import static uk.gegc.pixelperfect.features.model.TestBackends.upscaler;

@DisplayName("Model input builders")
class InputBuildersTest {

    private static final String IMAGE = "data:image/jpeg;base64,/9j/AAAA";

    private final PromptBuilder promptBuilder = new PromptBuilder();

    private static ImageInput input(ProcessingMode mode, int scale, boolean faces) {
        return new ImageInput(IMAGE, "image/jpeg", mode, scale, EnhancementSettings.none(), faces, false, null);
    }

    @ParameterizedTest(name = "requested {0} on {1} -> {2}")
    @CsvSource({
            "8, '2,4', 4",
            "4, '2,4', 4",
            "2, '4,8', 4",
            "8, '2,4,8', 8"
    })
    @DisplayName("scale is clamped to the nearest supported value not above the request")
    void clampScale(int requested, String scales, int expected) {
        Set<Integer> supported = new TreeSet<>();
        for (String s : scales.split(",")) {
            supported.add(Integer.parseInt(s));
        }
        BackendDescriptor backend = upscaler("b", "0.01", "1", 7.0, supported, SubscriptionTier.FREE);

        assertThat(ModelInputBuilder.clampScale(requested, backend)).isEqualTo(expected);
    }

    @Test
    @DisplayName("real-esrgan passes image, clamped scale and face flag")
    void realEsrgan() {
        BackendDescriptor backend = upscaler("real-esrgan", "0.002", "1", 7.0, Set.of(2, 4), SubscriptionTier.FREE);

        Map<String, Object> body = new RealEsrganInputBuilder().build(input(ProcessingMode.UPSCALE, 8, true), backend);

        assertThat(body).isEqualTo(Map.of("image", IMAGE, "scale", 4, "face_enhance", true));
    }

    @Test
    @DisplayName("gfpgan uses the img key and a pinned version")
    void gfpgan() {
        BackendDescriptor backend = upscaler("gfpgan", "0.003", "1", 7.5, Set.of(2, 4), SubscriptionTier.FREE,
                ModelCapability.FACE_RESTORATION);

        Map<String, Object> body = new GfpganInputBuilder().build(input(ProcessingMode.UPSCALE, 2, true), backend);

        assertThat(body)
                .containsEntry("img", IMAGE)
                .containsEntry("scale", 2)
                .containsEntry("version", "v1.4");
    }

    @Nested
    @DisplayName("prompt-driven backends")
    class PromptDriven {

        @Test
        @DisplayName("nano-banana-pro picks 2K for 2x and 4K above")
        void nanoBananaProResolution() {
            BackendDescriptor backend = upscaler("nano-banana-pro", "0.15", "1", 9.5, Set.of(2, 4, 8),
                    SubscriptionTier.PRO);

            Map<String, Object> body = new NanoBananaProInputBuilder(promptBuilder)
                    .build(input(ProcessingMode.UPSCALE, 4, false), backend);

            assertThat(body.get("resolution")).isEqualTo("4K");
            assertThat(body.get("image_input")).isEqualTo(List.of(IMAGE));
            assertThat((String) body.get("prompt")).startsWith("Upscale this image to 4x resolution");
            assertThat(NanoBananaProInputBuilder.resolutionFor(2)).isEqualTo("2K");
            assertThat(NanoBananaProInputBuilder.resolutionFor(8)).isEqualTo("4K");
        }

        @Test
        @DisplayName("flux-2-pro forbids creative changes")
        void fluxNoCreativeChanges() {
            BackendDescriptor backend = enhancer("flux-2-pro", "0.05", "1", 9.0, SubscriptionTier.HOBBY);

            Map<String, Object> body = new Flux2ProInputBuilder(promptBuilder)
                    .build(input(ProcessingMode.ENHANCE, 2, false), backend);

            assertThat((String) body.get("prompt")).endsWith("No creative changes.");
            assertThat(body).containsEntry("input_images", List.of(IMAGE)).containsEntry("output_format", "png");
        }

        @Test
        @DisplayName("qwen-image-edit sends the image as a list")
        void qwen() {
            BackendDescriptor backend = enhancer("qwen-image-edit", "0.03", "1", 8.0, SubscriptionTier.HOBBY);

            Map<String, Object> body = new QwenImageEditInputBuilder(promptBuilder)
                    .build(input(ProcessingMode.ENHANCE, 2, false), backend);

            assertThat(body).containsEntry("image", List.of(IMAGE)).containsEntry("output_quality", 95);
        }

        @Test
        @DisplayName("clarity-upscaler uses its stock prompt unless the user overrides it")
        void clarity() {
            BackendDescriptor backend = upscaler("clarity-upscaler", "0.02", "1", 8.5, Set.of(2, 4),
                    SubscriptionTier.HOBBY);
            ImageInput custom = new ImageInput(IMAGE, "image/jpeg", ProcessingMode.CUSTOM, 2,
                    EnhancementSettings.none(), false, false, "crisp architecture");

            ClarityUpscalerInputBuilder builder = new ClarityUpscalerInputBuilder(promptBuilder);

            assertThat(builder.build(input(ProcessingMode.UPSCALE, 4, false), backend))
                    .containsEntry("prompt", ClarityUpscalerInputBuilder.DEFAULT_PROMPT)
                    .containsEntry("scale_factor", 4);
            assertThat(builder.build(custom, backend)).containsEntry("prompt", "crisp architecture");
        }

        @Test
        @DisplayName("nano-banana sends the reconstruction prompt with the MIME type")
        void nanoBanana() {
            BackendDescriptor backend = upscaler("nano-banana", "0.039", "1", 8.0, Set.of(2, 4, 8),
                    SubscriptionTier.FREE);

            Map<String, Object> body = new NanoBananaInputBuilder(promptBuilder)
                    .build(input(ProcessingMode.UPSCALE, 8, false), backend);

            assertThat(body).containsEntry("image", IMAGE).containsEntry("mime_type", "image/jpeg");
            assertThat((String) body.get("prompt")).contains("8x resolution");
        }
    }
}
