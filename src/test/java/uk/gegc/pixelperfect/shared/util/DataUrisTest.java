package uk.gegc.pixelperfect.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataUrisTest {

    @Test
    @DisplayName("raw base64 is wrapped with the given MIME type, defaulting to PNG")
    void wrapsRawBase64() {
        assertThat(DataUris.toDataUri(" iVBORw0KGgo= ", "IMAGE/JPEG")).isEqualTo("data:image/jpeg;base64,iVBORw0KGgo=");
        assertThat(DataUris.toDataUri("iVBORw0KGgo=", null)).isEqualTo("data:image/png;base64,iVBORw0KGgo=");
    }

    @Test
    @DisplayName("data URIs and URLs pass through unchanged")
    void passesThroughUrisAndUrls() {
        assertThat(DataUris.toDataUri("data:image/webp;base64,AAAA", "image/png")).isEqualTo("data:image/webp;base64,AAAA");
        assertThat(DataUris.toDataUri("https://cdn.example.com/in.png", null)).isEqualTo("https://cdn.example.com/in.png");
    }

    @Test
    @DisplayName("blank image data is rejected")
    void rejectsBlank() {
        assertThatThrownBy(() -> DataUris.toDataUri("  ", "image/png"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Image data is required");
    }

    @Test
    @DisplayName("MIME type and payload are read from a data URI")
    void readsParts() {
        String uri = "DATA:Image/PNG;base64,iVBORw0KGgo=";

        assertThat(DataUris.isDataUri(uri)).isTrue();
        assertThat(DataUris.mimeType(uri)).isEqualTo("image/png");
        assertThat(DataUris.payload(uri)).isEqualTo("iVBORw0KGgo=");
        assertThat(DataUris.mimeType("https://cdn.example.com/a.png")).isNull();
        assertThat(DataUris.mimeType("data:,abc")).isNull();
    }

    @Test
    @DisplayName("payload requires a base64 data URI")
    void payloadRequiresBase64() {
        assertThatThrownBy(() -> DataUris.payload("data:text/plain,hello"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataUris.payload("https://cdn.example.com/a.png"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
