package uk.gegc.pixelperfect.features.processing.infra.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;
import uk.gegc.pixelperfect.shared.util.DataUris;

import java.util.Map;

/**
 * Gemini {@code generateContent} with image output. Returns the generated image as a data URI.
 */
@Component
public class GeminiImageBackend implements ImageBackend {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final BackendProperties.Gemini properties;

    public GeminiImageBackend(RestClient.Builder restClientBuilder,
                              ObjectMapper objectMapper,
                              BackendProperties backendProperties) {
        this.properties = backendProperties.getGemini();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderKind providerKind() {
        return ProviderKind.GEMINI;
    }

    @Override
    public Object call(BackendDescriptor backend, Map<String, Object> input) {
        String image = String.valueOf(input.get("image"));
        String mimeType = input.get("mime_type") != null
                ? String.valueOf(input.get("mime_type"))
                : DataUris.mimeType(image);

        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        ArrayNode parts = user.putArray("parts");
        ObjectNode inline = parts.addObject().putObject("inlineData");
        inline.put("mimeType", mimeType == null ? "image/png" : mimeType);
        inline.put("data", DataUris.payload(image));
        parts.addObject().put("text", String.valueOf(input.get("prompt")));

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.putArray("responseModalities").add("IMAGE");

        JsonNode response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent", backend.modelVersion())
                .header("x-goog-api-key", properties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new BackendException("Gemini returned an empty result");
        }
        return extractImage(response);
    }

    static String extractImage(JsonNode response) {
        JsonNode candidate = response.path("candidates").path(0);
        String finishReason = candidate.path("finishReason").asText("");
        if (!finishReason.isEmpty() && !"STOP".equals(finishReason)) {
            throw new BackendException(finishReasonMessage(finishReason));
        }

        JsonNode parts = candidate.path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            throw new BackendException("No output generated by the model.");
        }
        for (JsonNode part : parts) {
            JsonNode inline = part.path("inlineData");
            String data = inline.path("data").asText("");
            if (!data.isEmpty()) {
                String mime = inline.path("mimeType").asText("image/png");
                return "data:" + mime + ";base64," + data;
            }
        }
        for (JsonNode part : parts) {
            String text = part.path("text").asText("");
            if (!text.isEmpty()) {
                throw new BackendException("The model returned text instead of an image: "
                        + text.substring(0, Math.min(100, text.length())));
            }
        }
        throw new BackendException("No image data found in the response.");
    }

    static String finishReasonMessage(String finishReason) {
        return switch (finishReason) {
            case "RECITATION" -> "The model detected that the output would be too similar to the input (Recitation). "
                    + "Try using the 'Enhance' mode or changing the upscale factor.";
            case "SAFETY" -> "The image triggered the model's safety filters.";
            default -> "Model stopped generation. Reason: " + finishReason;
        };
    }
}
