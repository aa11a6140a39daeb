package uk.gegc.pixelperfect.features.processing.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingErrorCode;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OutputNormalizer")
class OutputNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final OutputNormalizer normalizer =
            new OutputNormalizer(Clock.fixed(NOW, ZoneOffset.UTC), new OutputProperties());

    @Test
    @DisplayName("first element of a list of URLs, MIME type from the extension")
    void listOfUrls() {
        CanonicalResult result = normalizer.normalize(List.of("https://x/y/out.PNG", "https://x/y/other.jpg"));

        assertThat(result.imageUrl()).isEqualTo("https://x/y/out.PNG");
        assertThat(result.mimeType()).isEqualTo("image/png");
        assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "https://cdn.example.com/a/b.webp?sig=abc, image/webp",
            "https://cdn.example.com/a/b.png#frag, image/png",
            "https://cdn.example.com/a/b.jpeg, image/jpeg",
            "https://cdn.example.com/a/b, image/jpeg"
    })
    @DisplayName("extension detection ignores query and fragment")
    void mimeFromPath(String url, String expected) {
        assertThat(OutputNormalizer.detectMimeType(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("inline data URIs keep their declared type and never expire")
    void dataUri() {
        CanonicalResult result = normalizer.normalize("data:image/webp;base64,UklGRg==");

        assertThat(result.mimeType()).isEqualTo("image/webp");
        assertThat(result.expiresAt()).isNull();
    }

    @Nested
    @DisplayName("shapes")
    class Shapes {

        @Test
        @DisplayName("object with a url string")
        void urlProperty() {
            assertThat(normalizer.normalize(Map.of("url", "https://a/b.png")).imageUrl()).isEqualTo("https://a/b.png");
        }

        @Test
        @DisplayName("object with a url accessor")
        void urlSupplier() {
            Supplier<String> accessor = () -> "https://a/file.webp";

            assertThat(normalizer.normalize(Map.of("url", accessor)).mimeType()).isEqualTo("image/webp");
        }

        @Test
        @DisplayName("object with an href")
        void hrefProperty() {
            assertThat(normalizer.normalize(Map.of("href", "https://a/c.jpg")).imageUrl()).isEqualTo("https://a/c.jpg");
        }

        @Test
        @DisplayName("JSON array and URI values")
        void jsonAndUri() throws Exception {
            ObjectMapper mapper = new ObjectMapper();

            assertThat(normalizer.normalize(mapper.readTree("[\"https://a/j.png\"]")).imageUrl())
                    .isEqualTo("https://a/j.png");
            assertThat(normalizer.normalize(mapper.readTree("{\"url\":\"https://a/k.png\"}")).imageUrl())
                    .isEqualTo("https://a/k.png");
            assertThat(normalizer.normalize(URI.create("https://a/u.webp")).mimeType()).isEqualTo("image/webp");
        }

        @Test
        @DisplayName("surrounding whitespace is trimmed")
        void trimmed() {
            assertThat(normalizer.normalize("  https://a/t.png \n").imageUrl()).isEqualTo("https://a/t.png");
        }
    }

    @Nested
    @DisplayName("missing output")
    class Missing {

        @Test
        void emptyList() {
            assertNoOutput(List.of());
        }

        @Test
        void nullOutput() {
            assertNoOutput(null);
        }

        @Test
        void blankString() {
            assertNoOutput("   ");
        }

        @Test
        void unrelatedObject() {
            assertNoOutput(Map.of("status", "succeeded"));
        }

        private void assertNoOutput(Object raw) {
            assertThatThrownBy(() -> normalizer.normalize(raw))
                    .isInstanceOfSatisfying(ProcessingException.class,
                            ex -> assertThat(ex.getCode()).isEqualTo(ProcessingErrorCode.NO_OUTPUT));
        }
    }
}
