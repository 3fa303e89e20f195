package com.vidnyan.dtc.application.port.out;

import com.vidnyan.dtc.domain.model.CodeRecord;

/**
 * Port for plain-language explanations of a code.
 * Implemented by an offline template or a remote text-generation service.
 */
public interface Explainer {

    Explanation explain(CodeRecord record);

    /**
     * Explanation text and the provider that produced it.
     */
    record Explanation(
        String code,
        String text,
        String provider
    ) {}
}
