package com.maestro.core.checkpoint;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Predicate;

/**
 * File-system operations used to snapshot and restore project trees.
 */
public interface FileTreeCopier {

    /**
     * Copies {@code source} (a file or directory) to {@code target}, creating parents as needed.
     * Paths matching {@code exclude} are skipped along with their subtrees.
     */
    void copy(Path source, Path target, Predicate<Path> exclude) throws IOException;

    default void copy(Path source, Path target) throws IOException {
        copy(source, target, p -> false);
    }

    /** Deletes a file or a whole directory tree; a missing path is not an error. */
    void delete(Path path) throws IOException;
}
