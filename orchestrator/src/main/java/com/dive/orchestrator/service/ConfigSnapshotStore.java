package com.dive.orchestrator.service;

import com.dive.orchestrator.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Filesystem half of a checkpoint: copies of an instance's configuration
 * directory.
 *
 * Layout:
 * <pre>
 *   {instances-root}/{instance}/                  live configuration
 *   {snapshot-root}/{instance}/{phase}/           snapshot taken when phase completed
 * </pre>
 */
@Component
public class ConfigSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigSnapshotStore.class);

    private final Path instancesRoot;
    private final Path snapshotRoot;

    public ConfigSnapshotStore(@Value("${dive.orchestrator.instances-root:./instances}") Path instancesRoot,
                               @Value("${dive.orchestrator.snapshot-root:./.dive-state/checkpoints}") Path snapshotRoot) {
        this.instancesRoot = instancesRoot.toAbsolutePath().normalize();
        this.snapshotRoot  = snapshotRoot.toAbsolutePath().normalize();
    }

    public Path liveDirectory(String instanceCode) {
        return instancesRoot.resolve(StateStore.normalize(instanceCode));
    }

    public Path snapshotDirectory(String instanceCode, Phase phase) {
        return snapshotRoot.resolve(StateStore.normalize(instanceCode)).resolve(phase.name().toLowerCase(Locale.ROOT));
    }

    /**
     * Replace the phase's snapshot with a fresh copy of the live directory.
     * An instance without a live directory yields an empty snapshot.
     */
    public Path capture(String instanceCode, Phase phase) {
        Path target = snapshotDirectory(instanceCode, phase);
        try {
            deleteTree(target);
            Files.createDirectories(target);
            Path live = liveDirectory(instanceCode);
            if (Files.isDirectory(live)) {
                copyTree(live, target);
            }
            log.debug("Snapshot of {} for {} written to {}", instanceCode, phase, target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot of " + instanceCode + " for " + phase + " failed", e);
        }
    }

    /**
     * Make the live directory an exact copy of {@code snapshot}.
     *
     * @throws UncheckedIOException if the snapshot is missing or the copy fails
     */
    public void restore(String instanceCode, Path snapshot) {
        if (snapshot == null || !Files.isDirectory(snapshot)) {
            throw new UncheckedIOException(new IOException("Snapshot directory missing: " + snapshot));
        }
        Path live = liveDirectory(instanceCode);
        try {
            deleteTree(live);
            Files.createDirectories(live);
            copyTree(snapshot, live);
            log.info("Restored configuration of {} from {}", instanceCode, snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Restore of " + instanceCode + " from " + snapshot + " failed", e);
        }
    }

    public void delete(String instanceCode, Phase phase) {
        try {
            deleteTree(snapshotDirectory(instanceCode, phase));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete snapshot " + instanceCode + "/" + phase, e);
        }
    }

    public void deleteAll(String instanceCode) {
        try {
            deleteTree(snapshotRoot.resolve(StateStore.normalize(instanceCode)));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete snapshots of " + instanceCode, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void copyTree(Path source, Path target) throws IOException {
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path p : (Iterable<Path>) paths::iterator) {
                Path dest = target.resolve(source.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(dest);
                } else {
                    Files.copy(p, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }
}
