package com.mouse.crawl.manager;

import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.credential.CredentialSource;
import com.mouse.crawl.credential.LoadedCredentials;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.model.Session;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-wide pool of authenticated sessions.
 * Selection reads health counters; only {@link #markGood} and {@link #markBad} mutate them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionPool {

    private static final Comparator<Session> LEAST_WORN =
            Comparator.comparingInt(Session::getErrorCount).thenComparingInt(Session::getUsageCount);

    private final CrawlerConfig config;
    private final CredentialSource credentialSource;

    // insertion order keeps tie-breaks stable between runs
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<String> loadOrder = new CopyOnWriteArrayList<>();

    @PostConstruct
    void init() {
        List<Session> loaded = loadAll();
        if (loaded.isEmpty()) {
            log.warn("No sessions loaded from {}; crawls will fail until credentials are added", config.getSessionDir());
        }
    }

    /**
     * Reads every credential file once. Files that fail validation are logged and skipped.
     */
    public List<Session> loadAll() {
        Path dir = Paths.get(config.getSessionDir());
        if (!Files.isDirectory(dir)) {
            log.warn("Session directory not found: {}", dir.toAbsolutePath());
            return List.of();
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, credentialSource.fileGlob())) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Failed to scan session directory {}: {}", dir, e.getMessage());
            return List.of();
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<Session> loaded = new ArrayList<>();
        for (Path file : files) {
            String id = stripExtension(file.getFileName().toString());
            try {
                LoadedCredentials credentials = credentialSource.loadCredentials(file);
                Session session = new Session(id, credentials.cookies(), credentials.identityLabel(), file.toString());
                if (register(session)) {
                    loaded.add(session);
                }
            } catch (CrawlException e) {
                log.warn("Skipping credential file {}: {}", file.getFileName(), e.getMessage());
            }
        }

        log.info("Loaded {} session(s) from {}", loaded.size(), dir);
        return loaded;
    }

    /**
     * @return false if a session with the same id is already present
     */
    public boolean register(Session session) {
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            log.warn("Duplicate session id {} ignored", session.getId());
            return false;
        }
        loadOrder.add(session.getId());
        return true;
    }

    /**
     * Returns the preferred session when it is still active, otherwise the least worn active
     * session other than {@code excludeId}. Null when nothing qualifies.
     */
    public Session selectNext(String preferredId, String excludeId) {
        if (preferredId != null) {
            Session preferred = sessions.get(preferredId);
            if (preferred != null && preferred.isActive()) {
                return preferred;
            }
        }
        return allActive().stream()
                .filter(s -> !s.getId().equals(excludeId))
                .min(LEAST_WORN)
                .orElse(null);
    }

    /** Least worn active session whose id is not in {@code triedIds}. */
    public Session selectUntried(Collection<String> triedIds) {
        return allActive().stream()
                .filter(s -> !triedIds.contains(s.getId()))
                .min(LEAST_WORN)
                .orElse(null);
    }

    public void markGood(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        session.recordSuccess();
        log.debug("Session {} ok (usage={}, errors={})", sessionId, session.getUsageCount(), session.getErrorCount());
    }

    public void markBad(String sessionId, String reason) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        boolean retiredNow = session.recordFailure(config.getSessionMaxErrorCount(), config.getSessionMaxConsecutiveFailures());
        if (retiredNow) {
            log.error("Session {} retired after {} errors ({} consecutive): {}",
                    sessionId, session.getErrorCount(), session.getConsecutiveFailures(), reason);
        } else {
            log.warn("Session {} marked bad (errors={}, consecutive={}): {}",
                    sessionId, session.getErrorCount(), session.getConsecutiveFailures(), reason);
        }
    }

    public List<Session> allActive() {
        return loadOrder.stream()
                .map(sessions::get)
                .filter(Session::isActive)
                .collect(Collectors.toList());
    }

    public Optional<Session> getById(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    public boolean hasActive() {
        return !allActive().isEmpty();
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
