package com.mouse.crawl.manager;

import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.model.Proxy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Outbound proxies with a sticky session-to-proxy binding.
 * An empty pool is legal and means direct egress.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProxyPool {

    private final CrawlerConfig config;

    private final Map<String, Proxy> proxies = new ConcurrentHashMap<>();
    private final List<String> loadOrder = new CopyOnWriteArrayList<>();
    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        loadAll();
    }

    /**
     * Reads {@code host:port:username:password} lines from every {@code *.txt} file in the proxy directory.
     */
    public List<Proxy> loadAll() {
        Path dir = Paths.get(config.getProxyDir());
        if (!Files.isDirectory(dir)) {
            log.info("Proxy directory {} not found, using direct connections", dir.toAbsolutePath());
            return List.of();
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.txt")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Failed to scan proxy directory {}: {}", dir, e.getMessage());
            return List.of();
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<Proxy> loaded = new ArrayList<>();
        for (Path file : files) {
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Skipping unreadable proxy file {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            for (String line : lines) {
                parseLine(line).ifPresent(proxy -> {
                    if (register(proxy)) {
                        loaded.add(proxy);
                    }
                });
            }
        }

        log.info("Loaded {} prox{} from {}", loaded.size(), loaded.size() == 1 ? "y" : "ies", dir);
        return loaded;
    }

    static Optional<Proxy> parseLine(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return Optional.empty();
        }
        String[] parts = trimmed.split(":", 4);
        if (parts.length != 2 && parts.length != 4) {
            log.warn("Malformed proxy line ignored: {}", trimmed);
            return Optional.empty();
        }
        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            log.warn("Invalid proxy port in line: {}", trimmed);
            return Optional.empty();
        }
        if (parts[0].isBlank() || port <= 0 || port > 65535) {
            log.warn("Invalid proxy address in line: {}", trimmed);
            return Optional.empty();
        }
        return parts.length == 4
                ? Optional.of(new Proxy(parts[0], port, parts[2], parts[3]))
                : Optional.of(new Proxy(parts[0], port, null, null));
    }

    public boolean register(Proxy proxy) {
        if (proxies.putIfAbsent(proxy.getId(), proxy) != null) {
            log.debug("Duplicate proxy {} ignored", proxy.getId());
            return false;
        }
        loadOrder.add(proxy.getId());
        return true;
    }

    /**
     * Sticky proxy for a session. The first call binds by hash over the active proxies;
     * the binding only moves when the bound proxy has been retired.
     *
     * @return null when no active proxy exists
     */
    public Proxy resolveFor(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        String boundId = bindings.compute(sessionId, (sid, current) -> {
            if (current != null && proxies.get(current).isActive()) {
                return current;
            }
            List<Proxy> active = allActive();
            if (active.isEmpty()) {
                if (current != null) {
                    log.error("Proxy {} for session {} retired and no active proxy remains", current, sid);
                }
                return null;
            }
            Proxy chosen = active.get(Math.floorMod(sid.hashCode(), active.size()));
            if (current != null) {
                log.warn("Session {} rebound from retired proxy {} to {}", sid, current, chosen.getId());
            } else {
                log.debug("Session {} bound to proxy {}", sid, chosen.getId());
            }
            return chosen.getId();
        });
        return boundId == null ? null : proxies.get(boundId);
    }

    public void markGood(String proxyId) {
        Proxy proxy = proxyId == null ? null : proxies.get(proxyId);
        if (proxy != null) {
            proxy.recordSuccess();
        }
    }

    public void markBad(String proxyId, String reason) {
        Proxy proxy = proxyId == null ? null : proxies.get(proxyId);
        if (proxy == null) {
            return;
        }
        boolean retiredNow = proxy.recordFailure(config.getProxyMaxErrorCount(), config.getProxyMaxConsecutiveFailures());
        if (retiredNow) {
            log.error("Proxy {} retired after {} errors: {}", proxyId, proxy.getErrorCount(), reason);
        } else {
            log.warn("Proxy {} marked bad (errors={}): {}", proxyId, proxy.getErrorCount(), reason);
        }
    }

    public List<Proxy> allActive() {
        return loadOrder.stream()
                .map(proxies::get)
                .filter(Proxy::isActive)
                .collect(Collectors.toList());
    }

    public Optional<Proxy> getById(String proxyId) {
        return Optional.ofNullable(proxyId).map(proxies::get);
    }

    public boolean hasProxies() {
        return !proxies.isEmpty();
    }
}
