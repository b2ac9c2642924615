package com.maestro.core.model;

import java.io.Serializable;

/**
 * Assembled execution directive for a stage, plus the model tier resolved for it.
 */
public record StageDirective(
        Stage stage,
        String text,
        ModelTier modelTier,
        int attempt
) implements Serializable {

    public StageDirective withText(String newText, int newAttempt) {
        return new StageDirective(stage, newText, modelTier, newAttempt);
    }
}
