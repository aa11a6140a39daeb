package uk.gegc.pixelperfect.features.processing.infra.input;

import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.processing.domain.model.EnhancementSettings;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes text instructions for prompt-driven backends.
 * User-supplied instructions always replace the generated prompt.
 */
@Component
public class PromptBuilder {

    static final String ENHANCE_FACES = "Enhance facial features naturally without altering identity.";
    static final String PRESERVE_TEXT = "Preserve and sharpen any text or logos in the image.";
    static final String NO_CREATIVE_CHANGES = "No creative changes.";

    public String build(String basePrompt, ImageInput input) {
        return build(basePrompt, input, false);
    }

    public String build(String basePrompt, ImageInput input, boolean noCreativeChanges) {
        if (input.hasCustomInstructions()) {
            return input.customInstructions().trim();
        }

        List<String> sentences = new ArrayList<>();
        sentences.add(terminate(basePrompt));
        if (input.enhance()) {
            String actions = enhancementInstructions(input.enhancement());
            if (!actions.isEmpty()) {
                sentences.add(actions);
            }
        }
        if (input.enhanceFaces()) {
            sentences.add(ENHANCE_FACES);
        }
        if (input.preserveText()) {
            sentences.add(PRESERVE_TEXT);
        }
        if (noCreativeChanges) {
            sentences.add(NO_CREATIVE_CHANGES);
        }
        if (sentences.size() == 1) {
            return basePrompt;
        }
        return String.join(" ", sentences);
    }

    /**
     * Comma-separated list of the selected enhancement actions ending with a period, or an empty string.
     */
    public String enhancementInstructions(EnhancementSettings settings) {
        List<String> actions = new ArrayList<>();
        if (settings.clarity()) {
            actions.add("sharpen edges and improve overall clarity");
        }
        if (settings.color()) {
            actions.add("balance color saturation and correct color casts");
        }
        if (settings.lighting()) {
            actions.add("optimize exposure and lighting balance");
        }
        if (settings.denoise()) {
            actions.add("remove sensor noise and grain while preserving details");
        }
        if (settings.artifacts()) {
            actions.add("eliminate compression artifacts and blocky patterns");
        }
        if (settings.details()) {
            actions.add("enhance fine textures and subtle details");
        }
        if (actions.isEmpty()) {
            return "";
        }
        String joined = String.join(", ", actions) + ".";
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1);
    }

    /**
     * Task/action/constraint prompt used by generative image models that take a single instruction.
     */
    public String reconstructionPrompt(ImageInput input) {
        if (input.hasCustomInstructions()) {
            return input.customInstructions().trim();
        }
        StringBuilder prompt = new StringBuilder(
                "Task: Generate a high-definition version of the provided image with significantly improved quality. ");
        prompt.append("Action: ");
        if (input.enhance()) {
            prompt.append("Reconstruct the image at ").append(input.scale())
                    .append("x resolution. Simultaneously remove noise/artifacts and sharpen fine details. ")
                    .append("The output must be crisp and photorealistic. ");
        } else {
            prompt.append("Reconstruct the image at ").append(input.scale())
                    .append("x resolution (target 2K/4K). Aggressively sharpen edges and hallucinate plausible ")
                    .append("fine details to remove blur. ");
        }
        if (input.enhanceFaces()) {
            prompt.append("Constraint: Enhance facial features naturally (eyes, skin texture) ")
                    .append("without altering the person's identity. ");
        }
        if (input.enhancement().denoise()) {
            prompt.append("Constraint: Apply strong denoising to smooth out flat areas. ");
        }
        if (input.preserveText()) {
            prompt.append("Constraint: Preserve all text, logos, and typography exactly as they appear. ");
        }
        prompt.append("Output: Return ONLY the generated image.");
        return prompt.toString();
    }

    private static String terminate(String sentence) {
        String trimmed = sentence == null ? "" : sentence.trim();
        if (trimmed.isEmpty() || trimmed.endsWith(".")) {
            return trimmed;
        }
        return trimmed + ".";
    }
}
