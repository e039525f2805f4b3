package com.composeops.docker;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A compose project directory together with its primary compose file.
 */
public record ComposeProject(Path directory, Path composeFile) {

    /** Compose file names in lookup order. */
    static final List<String> COMPOSE_FILE_NAMES = List.of(
            "docker-compose.yml",
            "docker-compose.yaml",
            "compose.yml",
            "compose.yaml"
    );

    /**
     * @throws ComposeProjectNotFoundException if the directory or its compose file is missing
     */
    public static ComposeProject resolve(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new ComposeProjectNotFoundException("Project directory not found", projectPath);
        }
        Path directory;
        try {
            directory = Path.of(projectPath);
        } catch (InvalidPathException e) {
            throw new ComposeProjectNotFoundException("Project directory not found", projectPath);
        }
        if (!Files.isDirectory(directory)) {
            throw new ComposeProjectNotFoundException("Project directory not found", projectPath);
        }
        return COMPOSE_FILE_NAMES.stream()
                .map(directory::resolve)
                .filter(Files::isRegularFile)
                .findFirst()
                .map(file -> new ComposeProject(directory, file))
                .orElseThrow(() -> new ComposeProjectNotFoundException(
                        "No compose file found in project directory", projectPath));
    }

    /**
     * Arguments selecting this project's compose file, followed by {@code args}.
     */
    public List<String> args(List<String> args) {
        var all = new ArrayList<String>(args.size() + 2);
        all.add("-f");
        all.add(composeFile.toString());
        all.addAll(args);
        return all;
    }
}
