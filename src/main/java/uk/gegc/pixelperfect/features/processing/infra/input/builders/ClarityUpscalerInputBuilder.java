package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;
import uk.gegc.pixelperfect.features.processing.infra.input.PromptBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ClarityUpscalerInputBuilder implements ModelInputBuilder {

    static final String DEFAULT_PROMPT = "masterpiece, best quality, highres";

    private final PromptBuilder promptBuilder;

    @Override
    public String backendId() {
        return "clarity-upscaler";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("image", input.imageDataUrl());
        body.put("prompt", promptBuilder.build(DEFAULT_PROMPT, input));
        body.put("scale_factor", ModelInputBuilder.clampScale(input.scale(), backend));
        body.put("output_format", "png");
        return body;
    }
}
