package uk.gegc.pixelperfect.features.model.domain.model;

/**
 * Signals extracted from the input image by an upstream analyser.
 *
 * @param damageLevel  0..1 estimate of scratches, tears and stains
 * @param textCoverage fraction of the image area covered by text
 * @param faceCount    number of detected faces
 * @param noiseLevel   0..1 estimate of sensor or compression noise
 */
public record ImageAnalysis(
        double damageLevel,
        double textCoverage,
        int faceCount,
        double noiseLevel,
        ContentType contentType
) {

    public ImageAnalysis {
        contentType = contentType == null ? ContentType.OTHER : contentType;
    }
}
