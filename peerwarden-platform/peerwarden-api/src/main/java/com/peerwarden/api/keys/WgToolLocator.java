package com.peerwarden.api.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.*;

/**
 * Finds a working {@code wg} executable.
 * 
 * Candidates are, in order: configured paths, {@code wg} itself, the usual
 * Windows install locations when running on Windows, and every directory on
 * {@code PATH}. A candidate counts only if {@code wg --version} exits cleanly
 * within the probe timeout. The first hit is remembered.
 */
public class WgToolLocator {

    private static final Logger log = LoggerFactory.getLogger(WgToolLocator.class);

    private final List<String> configuredPaths;
    private final Duration probeTimeout;
    private final boolean windows;
    private final Map<String, String> environment;

    private Optional<String> located;

    public WgToolLocator(List<String> configuredPaths, Duration probeTimeout) {
        this(configuredPaths, probeTimeout, System.getProperty("os.name", ""), System.getenv());
    }

    WgToolLocator(List<String> configuredPaths, Duration probeTimeout, String osName, Map<String, String> environment) {
        this.configuredPaths = configuredPaths != null ? List.copyOf(configuredPaths) : List.of();
        this.probeTimeout = probeTimeout;
        this.windows = osName.toLowerCase(Locale.ROOT).startsWith("windows");
        this.environment = environment;
    }

    /**
     * Returns the first working {@code wg} executable, probing on first use.
     */
    public synchronized Optional<String> locate() {
        if (located == null) {
            located = probeCandidates();
        }
        return located;
    }

    List<String> candidates() {
        LinkedHashSet<String> candidates = new LinkedHashSet<>(configuredPaths);
        candidates.add("wg");
        if (windows) {
            candidates.add("wg.exe");
            candidates.add("C:\\Program Files\\WireGuard\\wg.exe");
            candidates.add("C:\\Program Files (x86)\\WireGuard\\wg.exe");
            candidates.add(Paths.get(environment.getOrDefault("PROGRAMFILES", "C:\\Program Files"),
                    "WireGuard", "wg.exe").toString());
            candidates.add(Paths.get(environment.getOrDefault("PROGRAMFILES(X86)", "C:\\Program Files (x86)"),
                    "WireGuard", "wg.exe").toString());
        }

        String path = environment.getOrDefault("PATH", environment.getOrDefault("Path", ""));
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            if (windows) {
                candidates.add(Paths.get(dir.trim(), "wg.exe").toString());
            }
            candidates.add(Paths.get(dir.trim(), "wg").toString());
        }
        return new ArrayList<>(candidates);
    }

    private Optional<String> probeCandidates() {
        for (String candidate : candidates()) {
            if (probe(candidate)) {
                log.info("Found WireGuard tools at: {}", candidate);
                return Optional.of(candidate);
            }
        }
        log.info("WireGuard tools not found on this host");
        return Optional.empty();
    }

    private boolean probe(String candidate) {
        try {
            ToolProcess.Result result = ToolProcess.run(List.of(candidate, "--version"), null, probeTimeout);
            log.debug("Probed {}: exit {}", candidate, result.exitCode());
            return result.succeeded();
        } catch (IOException e) {
            log.debug("Probe of {} failed: {}", candidate, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
