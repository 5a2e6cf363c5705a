package com.maestro.ensemblespec.load;

import com.maestro.ensemblespec.EnsembleSpecJson;
import com.maestro.ensemblespec.model.EnsembleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads ensemble specifications from a directory of JSON files ({@code <ensembleId>.json}).
 * Files that cannot be read or parsed are logged and skipped. A file without a guid takes its
 * file name (without extension) as the ensemble id.
 */
public final class EnsembleSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(EnsembleSpecLoader.class);
    private static final String SUFFIX = ".json";

    private final Path specDir;

    public EnsembleSpecLoader(Path specDir) {
        this.specDir = Objects.requireNonNull(specDir, "specDir");
    }

    public Path getSpecDir() {
        return specDir;
    }

    /**
     * Loads {@code <ensembleId>.json} from the spec directory.
     *
     * @return the definition, or empty if the file is missing or invalid
     */
    public Optional<EnsembleDefinition> load(String ensembleId) {
        Path file = specDir.resolve(ensembleId + SUFFIX);
        if (!Files.isRegularFile(file)) {
            log.debug("No ensemble spec file for ensemble={} at {}", ensembleId, file);
            return Optional.empty();
        }
        return loadFile(file);
    }

    /**
     * Loads every {@code *.json} file in the spec directory, sorted by file name.
     *
     * @return valid definitions; empty if the directory does not exist
     */
    public List<EnsembleDefinition> loadAll() {
        if (!Files.isDirectory(specDir)) {
            log.warn("Ensemble spec directory does not exist: {}", specDir);
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(specDir, "*" + SUFFIX)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        } catch (IOException e) {
            log.error("Failed to list ensemble spec directory {}: {}", specDir, e.getMessage());
            return List.of();
        }
        files.sort(null);
        List<EnsembleDefinition> out = new ArrayList<>(files.size());
        for (Path file : files) {
            loadFile(file).ifPresent(out::add);
        }
        log.info("Loaded {} ensemble spec(s) from {}", out.size(), specDir);
        return out;
    }

    /**
     * Reads and parses one spec file.
     *
     * @return the definition, or empty on read or parse failure
     */
    public static Optional<EnsembleDefinition> loadFile(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read ensemble spec {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        EnsembleDefinition definition;
        try {
            definition = EnsembleSpecJson.fromJson(json);
        } catch (UncheckedIOException e) {
            log.warn("Invalid ensemble spec {}: {}", file, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        }
        if (definition == null) {
            log.warn("Empty ensemble spec {}", file);
            return Optional.empty();
        }
        if (definition.getGuid() == null || definition.getGuid().isBlank()) {
            String name = file.getFileName().toString();
            String id = name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
            definition = new EnsembleDefinition(id, definition.getCommand(), definition.getConnections(), definition.getPerformers());
        }
        log.debug("Loaded ensemble spec ensemble={} from {}", definition.getGuid(), file);
        return Optional.of(definition);
    }
}
