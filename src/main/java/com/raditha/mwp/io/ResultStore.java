package com.raditha.mwp.io;

import com.raditha.mwp.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads analysis reports as JSON files.
 */
public class ResultStore {

    private static final Logger logger = LoggerFactory.getLogger(ResultStore.class);

    /**
     * Save a report, creating parent directories as needed.
     */
    public void save(AnalysisReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, ResultCodec.toJson(report), StandardCharsets.UTF_8);
        logger.info("Saved result to {}", file);
    }

    public AnalysisReport load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Result file not found: " + file);
        }
        return ResultCodec.fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Default report location: {@code <directory>/<source name without extension>.json}.
     */
    public static Path defaultOutput(String directory, Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return Path.of(directory, base + ".json");
    }
}
