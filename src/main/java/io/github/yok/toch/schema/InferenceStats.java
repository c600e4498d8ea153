package io.github.yok.toch.schema;

import lombok.Value;

/**
 * Counters of one type-inference pass.
 */
@Value
public class InferenceStats {

    // Rows examined
    long rowsSampled;

    // Malformed rows skipped under row-error tolerance
    long rowsSkipped;
}
