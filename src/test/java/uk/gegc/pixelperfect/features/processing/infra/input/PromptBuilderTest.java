package uk.gegc.pixelperfect.features.processing.infra.input;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.processing.domain.model.EnhancementSettings;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PromptBuilder")
class PromptBuilderTest {

    private static final String BASE = "Upscale this image";

    private final PromptBuilder promptBuilder = new PromptBuilder();

    static ImageInput input(ProcessingMode mode, int scale, EnhancementSettings enhancement,
                            boolean faces, boolean text, String custom) {
        return new ImageInput("data:image/png;base64,AAAA", "image/png", mode, scale, enhancement, faces, text, custom);
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("custom instructions replace the generated prompt")
        void customInstructionsWin() {
            ImageInput input = input(ProcessingMode.CUSTOM, 2, EnhancementSettings.none(), true, true,
                    "  make it look like a 1970s postcard  ");

            assertThat(promptBuilder.build(BASE, input, true)).isEqualTo("make it look like a 1970s postcard");
        }

        @Test
        @DisplayName("base prompt is returned untouched when nothing is added")
        void plainBase() {
            ImageInput input = input(ProcessingMode.UPSCALE, 2, null, false, false, null);

            assertThat(promptBuilder.build(BASE, input)).isEqualTo(BASE);
        }

        @Test
        @DisplayName("enhancement actions are ignored for plain upscaling")
        void upscaleIgnoresEnhancement() {
            EnhancementSettings all = new EnhancementSettings(true, true, true, true, true, true);

            assertThat(promptBuilder.build(BASE, input(ProcessingMode.UPSCALE, 4, all, false, false, null)))
                    .isEqualTo(BASE);
        }

        @Test
        @DisplayName("sentences are appended in a fixed order")
        void appendsInOrder() {
            EnhancementSettings settings = new EnhancementSettings(true, false, false, true, false, false);
            ImageInput input = input(ProcessingMode.ENHANCE, 2, settings, true, true, null);

            String prompt = promptBuilder.build(BASE, input, true);

            assertThat(prompt).isEqualTo("Upscale this image. "
                    + "Sharpen edges and improve overall clarity, remove sensor noise and grain while preserving details. "
                    + PromptBuilder.ENHANCE_FACES + " "
                    + PromptBuilder.PRESERVE_TEXT + " "
                    + PromptBuilder.NO_CREATIVE_CHANGES);
        }

        @Test
        @DisplayName("blank custom instructions do not count")
        void blankCustomInstructions() {
            ImageInput input = input(ProcessingMode.UPSCALE, 2, null, true, false, "   ");

            assertThat(promptBuilder.build("Base.", input)).isEqualTo("Base. " + PromptBuilder.ENHANCE_FACES);
        }
    }

    @Test
    @DisplayName("no selected actions produce an empty instruction")
    void noActions() {
        assertThat(promptBuilder.enhancementInstructions(EnhancementSettings.none())).isEmpty();
    }

    @Test
    @DisplayName("reconstruction prompt carries the scale and the selected constraints")
    void reconstructionPrompt() {
        EnhancementSettings denoise = new EnhancementSettings(false, false, false, true, false, false);
        ImageInput input = input(ProcessingMode.BOTH, 4, denoise, true, true, null);

        String prompt = promptBuilder.reconstructionPrompt(input);

        assertThat(prompt)
                .startsWith("Task: Generate a high-definition version")
                .contains("Reconstruct the image at 4x resolution. Simultaneously remove noise/artifacts")
                .contains("without altering the person's identity")
                .contains("Apply strong denoising")
                .contains("Preserve all text, logos, and typography")
                .endsWith("Output: Return ONLY the generated image.");
    }

    @Test
    @DisplayName("plain upscale reconstruction targets 2K/4K")
    void reconstructionUpscale() {
        String prompt = promptBuilder.reconstructionPrompt(input(ProcessingMode.UPSCALE, 2, null, false, false, null));

        assertThat(prompt).contains("2x resolution (target 2K/4K)").doesNotContain("Constraint:");
    }
}
