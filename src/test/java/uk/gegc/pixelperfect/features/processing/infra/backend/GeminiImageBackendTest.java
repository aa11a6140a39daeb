package uk.gegc.pixelperfect.features.processing.infra.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeminiImageBackend response parsing")
class GeminiImageBackendTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String body) throws Exception {
        return mapper.readTree(body);
    }

    @Test
    @DisplayName("inline image data becomes a data URI")
    void inlineImage() throws Exception {
        JsonNode response = json("""
                {"candidates":[{"finishReason":"STOP","content":{"parts":[
                  {"text":"Here you go"},
                  {"inlineData":{"mimeType":"image/jpeg","data":"QUJD"}}
                ]}}]}
                """);

        assertThat(GeminiImageBackend.extractImage(response)).isEqualTo("data:image/jpeg;base64,QUJD");
    }

    @Test
    @DisplayName("a safety stop is reported as a safety failure")
    void safetyStop() throws Exception {
        JsonNode response = json("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}");

        assertThatThrownBy(() -> GeminiImageBackend.extractImage(response))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("safety filters");
    }

    @Test
    @DisplayName("recitation stops suggest another mode")
    void recitation() {
        assertThat(GeminiImageBackend.finishReasonMessage("RECITATION")).contains("Recitation");
        assertThat(GeminiImageBackend.finishReasonMessage("MAX_TOKENS"))
                .isEqualTo("Model stopped generation. Reason: MAX_TOKENS");
    }

    @Test
    @DisplayName("a text-only answer is an error")
    void textOnly() throws Exception {
        JsonNode response = json("""
                {"candidates":[{"content":{"parts":[{"text":"I cannot edit this picture"}]}}]}
                """);

        assertThatThrownBy(() -> GeminiImageBackend.extractImage(response))
                .hasMessage("The model returned text instead of an image: I cannot edit this picture");
    }

    @Test
    @DisplayName("no candidates means no output")
    void noCandidates() throws Exception {
        assertThatThrownBy(() -> GeminiImageBackend.extractImage(json("{}")))
                .hasMessageContaining("No output");
    }
}
