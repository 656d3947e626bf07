package com.logsampler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Structured key/value context attached to a facility or a single entry
 */
@Value(staticConstructor = "of")
public class Field {
    @NonNull
    String key;

    Object value;
}
