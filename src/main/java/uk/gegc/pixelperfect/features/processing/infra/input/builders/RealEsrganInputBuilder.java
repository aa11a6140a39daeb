package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class RealEsrganInputBuilder implements ModelInputBuilder {

    @Override
    public String backendId() {
        return "real-esrgan";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("image", input.imageDataUrl());
        body.put("scale", ModelInputBuilder.clampScale(input.scale(), backend));
        body.put("face_enhance", input.enhanceFaces());
        return body;
    }
}
