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
public class QwenImageEditInputBuilder implements ModelInputBuilder {

    static final String DEFAULT_PROMPT = "Improve this image while maintaining its original quality and sharpness.";

    private final PromptBuilder promptBuilder;

    @Override
    public String backendId() {
        return "qwen-image-edit";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", promptBuilder.build(DEFAULT_PROMPT, input, true));
        body.put("image", List.of(input.imageDataUrl()));
        body.put("aspect_ratio", "match_input_image");
        body.put("output_format", "png");
        body.put("output_quality", 95);
        body.put("go_fast", true);
        return body;
    }
}
