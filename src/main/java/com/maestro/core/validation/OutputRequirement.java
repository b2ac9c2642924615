package com.maestro.core.validation;

import java.util.List;

/**
 * One expected file under {@code stages/<id>/outputs/}.
 *
 * @param file     file name relative to the outputs directory
 * @param required missing file fails the stage (critical) rather than producing a finding (high)
 * @param minBytes minimum file size, 0 for none
 * @param sections markdown headings the file must contain
 */
public record OutputRequirement(String file, boolean required, long minBytes, List<String> sections) {

    public OutputRequirement {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public static OutputRequirement required(String file) {
        return new OutputRequirement(file, true, 0, List.of());
    }

    public static OutputRequirement optional(String file) {
        return new OutputRequirement(file, false, 0, List.of());
    }

    public OutputRequirement minBytes(long bytes) {
        return new OutputRequirement(file, required, bytes, sections);
    }

    public OutputRequirement sections(String... headings) {
        return new OutputRequirement(file, required, minBytes, List.of(headings));
    }
}
