package com.mouse.crawl.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.model.Checkpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Latest checkpoint per run in {@code <dir>/<runId>.json}, replaced atomically.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFileCheckpointSink implements CheckpointSink {

    private final CrawlerConfig config;
    private final ObjectMapper objectMapper;

    @Override
    public void saveCheckpoint(String runId, Checkpoint checkpoint) {
        if (runId == null || runId.isBlank()) {
            return;
        }
        Path dir = Paths.get(config.getCheckpointDir());
        Path target = dir.resolve(safeName(runId) + ".json");
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, safeName(runId) + "-ckpt", ".tmp");
            objectMapper.writeValue(tmp.toFile(), checkpoint);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpoint {} saved: cursor={} count={}", runId, checkpoint.cursor(), checkpoint.accumulatedCount());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save checkpoint for run {}: {}", runId, e.getMessage());
        }
    }

    static String safeName(String runId) {
        return runId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
