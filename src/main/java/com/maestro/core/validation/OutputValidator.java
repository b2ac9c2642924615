package com.maestro.core.validation;

import com.maestro.core.model.Stage;
import com.maestro.core.model.ValidationResult;

import java.util.List;

/**
 * Decides whether a stage's outputs are complete enough to finalize the stage.
 */
public interface OutputValidator {

    ValidationResult validate(Stage stage);

    /** Human-readable, file-by-file list of what the stage must produce. */
    default List<String> describeRequirements(Stage stage) {
        return List.of("stages/" + stage.id() + "/outputs/" + stage.primaryOutput());
    }
}
