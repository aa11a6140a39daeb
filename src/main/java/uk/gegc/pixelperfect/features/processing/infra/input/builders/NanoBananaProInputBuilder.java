package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;
import uk.gegc.pixelperfect.features.processing.infra.input.PromptBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NanoBananaProInputBuilder implements ModelInputBuilder {

    private final PromptBuilder promptBuilder;

    @Override
    public String backendId() {
        return "nano-banana-pro";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        String basePrompt = "Upscale this image to " + input.scale() + "x resolution with enhanced sharpness and detail.";
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", promptBuilder.build(basePrompt, input));
        body.put("image_input", List.of(input.imageDataUrl()));
        body.put("aspect_ratio", "match_input_image");
        body.put("resolution", resolutionFor(input.scale()));
        body.put("output_format", "png");
        body.put("safety_filter_level", "block_only_high");
        return body;
    }

    static String resolutionFor(int scale) {
        return scale <= 2 ? "2K" : "4K";
    }
}
