package uk.gegc.pixelperfect.features.processing.infra.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Replicate predictions API. Creates the prediction with {@code Prefer: wait} and polls until it reaches a
 * terminal status or the configured maximum wait elapses.
 */
@Slf4j
@Component
public class ReplicateImageBackend implements ImageBackend {

    private static final Set<String> TERMINAL = Set.of("succeeded", "failed", "canceled");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final BackendProperties.Replicate properties;
    private final Clock clock;

    public ReplicateImageBackend(RestClient.Builder restClientBuilder,
                                 ObjectMapper objectMapper,
                                 BackendProperties backendProperties,
                                 Clock clock) {
        this.properties = backendProperties.getReplicate();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderKind providerKind() {
        return ProviderKind.REPLICATE;
    }

    @Override
    public Object call(BackendDescriptor backend, Map<String, Object> input) {
        String modelVersion = backend.modelVersion();
        if (modelVersion == null || modelVersion.isBlank()) {
            throw new BackendException("No model version configured for " + backend.id());
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("input", objectMapper.valueToTree(input));

        JsonNode prediction;
        int colon = modelVersion.indexOf(':');
        if (colon > 0) {
            payload.put("version", modelVersion.substring(colon + 1));
            prediction = post("/v1/predictions", payload);
        } else {
            prediction = post("/v1/models/" + modelVersion + "/predictions", payload);
        }

        Instant deadline = clock.instant().plus(properties.getMaxWait());
        while (!TERMINAL.contains(prediction.path("status").asText())) {
            if (clock.instant().isAfter(deadline)) {
                throw new BackendException("Prediction " + prediction.path("id").asText() + " timed out after "
                        + properties.getMaxWait().toSeconds() + "s");
            }
            pause();
            prediction = get(prediction.path("id").asText());
        }

        return toOutput(prediction);
    }

    private Object toOutput(JsonNode prediction) {
        String status = prediction.path("status").asText();
        if ("failed".equals(status)) {
            String error = prediction.path("error").asText("");
            throw new BackendException(error.isBlank() ? "Model inference failed" : error);
        }
        if ("canceled".equals(status)) {
            throw new BackendException("Prediction " + prediction.path("id").asText() + " was canceled");
        }
        JsonNode output = prediction.get("output");
        if (output == null || output.isNull()) {
            throw new BackendException("No output returned from Replicate");
        }
        log.debug("Prediction {} succeeded", prediction.path("id").asText());
        return output;
    }

    private JsonNode post(String path, ObjectNode payload) {
        JsonNode response = restClient.post()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken())
                .header("Prefer", "wait")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new BackendException("Empty result from Replicate");
        }
        return response;
    }

    private JsonNode get(String predictionId) {
        JsonNode response = restClient.get()
                .uri("/v1/predictions/{id}", predictionId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken())
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new BackendException("Empty result from Replicate");
        }
        return response;
    }

    private void pause() {
        try {
            Thread.sleep(properties.getPollInterval().toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while waiting for prediction", ie);
        }
    }
}
