package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;
import uk.gegc.pixelperfect.features.processing.infra.input.PromptBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gemini image model: one instruction plus the inline image.
 */
@Component
@RequiredArgsConstructor
public class NanoBananaInputBuilder implements ModelInputBuilder {

    private final PromptBuilder promptBuilder;

    @Override
    public String backendId() {
        return "nano-banana";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", promptBuilder.reconstructionPrompt(input));
        body.put("image", input.imageDataUrl());
        body.put("mime_type", input.mimeType());
        return body;
    }
}
