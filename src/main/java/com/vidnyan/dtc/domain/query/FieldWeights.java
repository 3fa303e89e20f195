package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.index.TextField;

/**
 * Per-field ranking weights. Description must outrank causes, causes must outrank actions.
 */
public record FieldWeights(
    double description,
    double cause,
    double action
) {

    public static final FieldWeights DEFAULT = new FieldWeights(3.0, 2.0, 1.0);

    public FieldWeights {
        if (!(action > 0 && cause > action && description > cause)) {
            throw new IllegalArgumentException(String.format(
                    "Field weights must satisfy description > cause > action > 0, got %s/%s/%s",
                    description, cause, action));
        }
    }

    public double weightOf(TextField field) {
        return switch (field) {
            case DESCRIPTION -> description;
            case CAUSE -> cause;
            case ACTION -> action;
        };
    }
}
