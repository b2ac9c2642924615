package com.maestro.core.validation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Build systems recognized by their manifest file in the project root, in detection order.
 */
public enum ProjectType {
    MAVEN("Maven", List.of("pom.xml"), "mvn -B -q -DskipTests package", "mvn -B -q test"),
    GRADLE("Gradle", List.of("build.gradle", "build.gradle.kts"), "gradle build -x test", "gradle test"),
    NODE("npm", List.of("package.json"), "npm run build", "npm test"),
    DOTNET(".NET", List.of("*.csproj"), "dotnet build", "dotnet test"),
    PYTHON("Python", List.of("pyproject.toml", "setup.py"), "python -m compileall -q .", "pytest"),
    RUST("Cargo", List.of("Cargo.toml"), "cargo build", "cargo test"),
    GO("Go", List.of("go.mod"), "go build ./...", "go test ./...");

    private final String displayName;
    private final List<String> manifests;
    private final String buildCommand;
    private final String testCommand;

    ProjectType(String displayName, List<String> manifests, String buildCommand, String testCommand) {
        this.displayName = displayName;
        this.manifests = manifests;
        this.buildCommand = buildCommand;
        this.testCommand = testCommand;
    }

    public String displayName() { return displayName; }
    public List<String> manifests() { return manifests; }
    public String buildCommand() { return buildCommand; }
    public String testCommand() { return testCommand; }

    public static Optional<ProjectType> detect(Path projectRoot) {
        for (ProjectType type : values()) {
            if (type.matches(projectRoot)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private boolean matches(Path root) {
        for (String manifest : manifests) {
            if (manifest.startsWith("*")) {
                String suffix = manifest.substring(1);
                if (!Files.isDirectory(root)) continue;
                try (Stream<Path> files = Files.list(root)) {
                    if (files.anyMatch(p -> p.getFileName().toString().endsWith(suffix))) {
                        return true;
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            } else if (Files.exists(root.resolve(manifest))) {
                return true;
            }
        }
        return false;
    }
}
