package uk.gegc.pixelperfect.features.model.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend catalog configuration. Declaration order is catalog order.
 * The defaults describe the production backend set; deployments usually only override model versions.
 */
@Configuration
@ConfigurationProperties(prefix = "pixelperfect.models")
@Validated
@Data
public class ModelCatalogProperties {

    @Valid
    private List<Backend> backends = defaultBackends();

    /**
     * Use case key (e.g. {@code portraits}) to backend id.
     */
    private Map<String, String> useCases = defaultUseCases();

    @Data
    public static class Backend {
        @NotBlank
        private String id;
        private String displayName;
        /**
         * REPLICATE or GEMINI.
         */
        private String provider = "REPLICATE";
        /**
         * Provider-side model reference, e.g. {@code owner/name:version}.
         */
        private String modelVersion;
        private List<String> capabilities = new ArrayList<>();
        private BigDecimal costPerCall = BigDecimal.ZERO;
        private BigDecimal creditMultiplier = BigDecimal.ONE;
        private double qualityScore;
        private long processingTimeMs;
        private List<Integer> supportedScales = new ArrayList<>();
        private int maxInputResolution = 2048 * 2048;
        private int maxOutputResolution = 4096 * 4096;
        private boolean enabled = true;
        /**
         * Minimum tier, blank when the backend is open to every tier.
         */
        private String tierRestriction;
    }

    public static Backend backend(String id, String displayName, String provider, String modelVersion,
                           List<String> capabilities, String costPerCall, String creditMultiplier,
                           double qualityScore, long processingTimeMs, List<Integer> scales,
                           int maxOutputResolution, String tierRestriction) {
        Backend backend = new Backend();
        backend.setId(id);
        backend.setDisplayName(displayName);
        backend.setProvider(provider);
        backend.setModelVersion(modelVersion);
        backend.setCapabilities(new ArrayList<>(capabilities));
        backend.setCostPerCall(new BigDecimal(costPerCall));
        backend.setCreditMultiplier(new BigDecimal(creditMultiplier));
        backend.setQualityScore(qualityScore);
        backend.setProcessingTimeMs(processingTimeMs);
        backend.setSupportedScales(new ArrayList<>(scales));
        backend.setMaxOutputResolution(maxOutputResolution);
        backend.setTierRestriction(tierRestriction);
        return backend;
    }

    public static List<Backend> defaultBackends() {
        List<Backend> backends = new ArrayList<>();
        backends.add(backend("real-esrgan", "Real-ESRGAN", "REPLICATE", "nightmareai/real-esrgan",
                List.of("upscale", "denoise"), "0.0017", "1", 8.5, 2000,
                List.of(2, 4), 4096 * 4096, null));
        backends.add(backend("gfpgan", "GFPGAN", "REPLICATE",
                "tencentarc/gfpgan:0fbacf7afc6c144e5be9767cff80f25aff23e52b0708f17e20f9879b2f21516c",
                List.of("upscale", "face-restoration", "denoise", "damage-repair"), "0.0025", "2", 9.0, 3000,
                List.of(2, 4), 4096 * 4096, null));
        backends.add(backend("nano-banana", "Nano Banana", "GEMINI", "gemini-2.5-flash-image",
                List.of("upscale", "text-preservation", "enhance"), "0.0", "2", 8.0, 5000,
                List.of(2, 4, 8), 4096 * 4096, null));
        backends.add(backend("clarity-upscaler", "Clarity Upscaler", "REPLICATE",
                "philz1337x/clarity-upscaler:dfad41707589d68ecdccd1dfa600d55a208f9310748e44bfe35b4a6291453d5e",
                List.of("upscale", "denoise", "enhance"), "0.017", "4", 9.5, 8000,
                List.of(2, 4, 8), 8192 * 8192, "hobby"));
        backends.add(backend("flux-2-pro", "Flux 2 Pro", "REPLICATE", "black-forest-labs/flux-2-pro",
                List.of("enhance", "face-restoration"), "0.05", "6", 9.6, 15000,
                List.of(), 4096 * 4096, "hobby"));
        backends.add(backend("nano-banana-pro", "Nano Banana Pro", "REPLICATE", "google/nano-banana-pro",
                List.of("upscale", "enhance", "face-restoration", "denoise", "damage-repair", "4k-output", "8k-output"),
                "0.13", "8", 9.8, 20000, List.of(2, 4, 8), 8192 * 8192, "hobby"));
        backends.add(backend("qwen-image-edit", "Qwen Image Edit", "REPLICATE", "qwen/qwen-image-edit",
                List.of("enhance", "denoise"), "0.03", "3", 9.2, 10000,
                List.of(), 4096 * 4096, "hobby"));
        return backends;
    }

    public static Map<String, String> defaultUseCases() {
        Map<String, String> useCases = new LinkedHashMap<>();
        useCases.put("general-upscale", "real-esrgan");
        useCases.put("portraits", "gfpgan");
        useCases.put("damaged-photos", "nano-banana-pro");
        useCases.put("text-logos", "nano-banana");
        useCases.put("max-quality", "clarity-upscaler");
        return useCases;
    }
}
