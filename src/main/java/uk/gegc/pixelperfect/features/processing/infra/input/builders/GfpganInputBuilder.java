package uk.gegc.pixelperfect.features.processing.infra.input.builders;

import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class GfpganInputBuilder implements ModelInputBuilder {

    static final String GFPGAN_VERSION = "v1.4";

    @Override
    public String backendId() {
        return "gfpgan";
    }

    @Override
    public Map<String, Object> build(ImageInput input, BackendDescriptor backend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("img", input.imageDataUrl());
        body.put("scale", ModelInputBuilder.clampScale(input.scale(), backend));
        body.put("version", GFPGAN_VERSION);
        return body;
    }
}
