package uk.gegc.pixelperfect.features.processing.application.output;

import java.util.Optional;

/**
 * One step of the output-normalisation chain. Returns empty when the value does not have the shape it handles.
 */
public interface OutputUrlExtractor {

    Optional<String> extract(Object value);
}
