package com.dive.orchestrator.service;

import com.dive.orchestrator.error.ConfigurationException;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.model.Checkpoint;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.repository.CheckpointRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable per-phase completion markers with configuration snapshots.
 *
 * Resume logic reads it to skip finished phases; rollback reads it to find
 * the last good configuration. Phase names from outside are validated by
 * {@link Phase#parse} before anything is written.
 */
@Service
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    /** Token every destructive clear must carry. */
    public static final String CONFIRMATION_TOKEN = "confirm";

    private final CheckpointRepository checkpointRepo;
    private final ConfigSnapshotStore  snapshots;
    private final StateStore           stateStore;
    private final ObjectMapper         objectMapper;
    private final Clock                clock;
    private final String               hubCode;

    public CheckpointStore(CheckpointRepository checkpointRepo,
                           ConfigSnapshotStore snapshots,
                           StateStore stateStore,
                           ObjectMapper objectMapper,
                           Clock clock,
                           @Value("${dive.orchestrator.hub-code:usa}") String hubCode) {
        this.checkpointRepo = checkpointRepo;
        this.snapshots      = snapshots;
        this.stateStore     = stateStore;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
        this.hubCode        = StateStore.normalize(hubCode);
    }

    // ------------------------------------------------------------------
    // Marking
    // ------------------------------------------------------------------

    /**
     * Name-based entry point for callers outside the engine.
     *
     * @throws com.dive.orchestrator.error.InvalidPhaseException before any write
     *         when {@code phaseName} is not a declared phase
     */
    public Checkpoint markComplete(String instanceCode, String phaseName,
                                   Duration duration, Map<String, ?> data) {
        return markComplete(instanceCode, Phase.parse(phaseName), duration, data);
    }

    /**
     * Record {@code phase} as complete, overwriting any earlier checkpoint
     * for the same phase together with its snapshot.
     */
    @Transactional
    public Checkpoint markComplete(String instanceCode, Phase phase,
                                   Duration duration, Map<String, ?> data) {
        String code = StateStore.normalize(instanceCode);
        Path snapshot = snapshots.capture(code, phase);

        Checkpoint checkpoint = checkpointRepo.findByInstanceCodeAndPhase(code, phase)
                .orElseGet(() -> new Checkpoint(code, phase));
        checkpoint.setCreatedAt(clock.instant());
        checkpoint.setDurationSeconds(duration == null ? 0 : duration.toSeconds());
        checkpoint.setSnapshotPath(snapshot.toString());
        checkpoint.setData(toJson(data));

        Checkpoint saved = checkpointRepo.save(checkpoint);
        log.info("Checkpoint {} / {} saved ({}s)", code, phase, checkpoint.getDurationSeconds());
        return saved;
    }

    // ------------------------------------------------------------------
    // Resume queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public boolean isComplete(String instanceCode, Phase phase) {
        return checkpointRepo.existsByInstanceCodeAndPhase(StateStore.normalize(instanceCode), phase);
    }

    /** Completed phases in phase order, each at most once. */
    @Transactional(readOnly = true)
    public List<Phase> listCompleted(String instanceCode) {
        return completedSet(StateStore.normalize(instanceCode)).stream()
                .sorted()
                .toList();
    }

    /**
     * First phase not yet completed, in phase order. Empty once COMPLETE has
     * been marked: nothing is left to do.
     */
    @Transactional(readOnly = true)
    public Optional<Phase> nextPhase(String instanceCode) {
        Set<Phase> done = completedSet(StateStore.normalize(instanceCode));
        if (done.contains(Phase.COMPLETE)) return Optional.empty();
        for (Phase phase : Phase.values()) {
            if (!done.contains(phase)) return Optional.of(phase);
        }
        return Optional.empty();
    }

    /** True iff some checkpoint exists and COMPLETE is not among them. */
    @Transactional(readOnly = true)
    public boolean canResume(String instanceCode) {
        Set<Phase> done = completedSet(StateStore.normalize(instanceCode));
        return !done.isEmpty() && !done.contains(Phase.COMPLETE);
    }

    @Transactional(readOnly = true)
    public Optional<Checkpoint> latest(String instanceCode) {
        return checkpointRepo.findFirstByInstanceCodeOrderByCreatedAtDescIdDesc(StateStore.normalize(instanceCode));
    }

    @Transactional(readOnly = true)
    public List<Checkpoint> checkpoints(String instanceCode) {
        return checkpointRepo.findByInstanceCode(StateStore.normalize(instanceCode)).stream()
                .sorted(Comparator.comparing(Checkpoint::getPhase))
                .toList();
    }

    @Transactional(readOnly = true)
    public String summary(String instanceCode) {
        return "Completed " + listCompleted(instanceCode).size() + "/" + Phase.values().length + " phases";
    }

    // ------------------------------------------------------------------
    // Validation and reporting
    // ------------------------------------------------------------------

    /**
     * Check that completed phases form a prefix of phase order. Violations
     * are reported, never corrected.
     */
    @Transactional(readOnly = true)
    public CheckpointValidation validateState(String instanceCode) {
        String code = StateStore.normalize(instanceCode);
        Set<Phase> done = completedSet(code);
        Optional<Phase> lastDone = done.stream().max(Comparator.naturalOrder());

        List<Phase> gaps = new ArrayList<>();
        lastDone.ifPresent(last -> {
            for (Phase phase : Phase.values()) {
                if (phase.compareTo(last) >= 0) break;
                if (!done.contains(phase)) gaps.add(phase);
            }
        });
        if (!gaps.isEmpty()) {
            log.warn("Checkpoints of {} are inconsistent: {} missing before {}", code, gaps, lastDone.get());
        }
        return new CheckpointValidation(code, gaps.isEmpty(), done.stream().sorted().toList(), List.copyOf(gaps));
    }

    @Transactional(readOnly = true)
    public CheckpointReport report(String instanceCode) {
        String code = StateStore.normalize(instanceCode);
        List<CheckpointReport.PhaseEntry> phases = checkpoints(code).stream()
                .filter(c -> c.getPhase() != Phase.COMPLETE)
                .map(c -> new CheckpointReport.PhaseEntry(
                        c.getPhase().name(), c.getCreatedAt(), c.getDurationSeconds()))
                .toList();
        return new CheckpointReport(
                code,
                deploymentType(code),
                canResume(code),
                nextPhase(code).map(Phase::name).orElse(""),
                phases);
    }

    public String deploymentType(String instanceCode) {
        return hubCode.equals(StateStore.normalize(instanceCode)) ? "hub" : "spoke";
    }

    // ------------------------------------------------------------------
    // Destructive operations
    // ------------------------------------------------------------------

    @Transactional
    public boolean clearPhase(String instanceCode, Phase phase, String confirmation) {
        requireConfirmation(confirmation);
        String code = StateStore.normalize(instanceCode);
        boolean removed = checkpointRepo.deleteByInstanceCodeAndPhase(code, phase) > 0;
        snapshots.delete(code, phase);
        log.warn("Checkpoint {} / {} cleared (present={})", code, phase, removed);
        return removed;
    }

    @Transactional
    public long clearAll(String instanceCode, String confirmation) {
        requireConfirmation(confirmation);
        String code = StateStore.normalize(instanceCode);
        long removed = checkpointRepo.deleteByInstanceCode(code);
        snapshots.deleteAll(code);
        log.warn("All {} checkpoints of {} cleared", removed, code);
        return removed;
    }

    // ------------------------------------------------------------------
    // Rollback
    // ------------------------------------------------------------------

    /**
     * Copy the checkpoint's snapshot back over the live configuration, then
     * roll the recorded state back one transition.
     *
     * @throws ConfigurationException if the checkpoint has no snapshot
     * @throws java.io.UncheckedIOException if the copy fails
     */
    @Transactional
    public void restore(String instanceCode, Checkpoint checkpoint) {
        String code = StateStore.normalize(instanceCode);
        if (checkpoint.getSnapshotPath() == null) {
            throw new ConfigurationException(ErrorCode.INVALID_CHECKPOINT,
                    "Checkpoint " + code + "/" + checkpoint.getPhase() + " has no configuration snapshot");
        }
        snapshots.restore(code, Path.of(checkpoint.getSnapshotPath()));
        stateStore.rollbackState(code, "Restored checkpoint " + checkpoint.getPhase());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Set<Phase> completedSet(String code) {
        return checkpointRepo.findByInstanceCode(code).stream()
                .map(Checkpoint::getPhase)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Phase.class)));
    }

    private static void requireConfirmation(String confirmation) {
        if (!CONFIRMATION_TOKEN.equals(confirmation)) {
            throw new IllegalArgumentException(
                    "Destructive operation requires confirmation token '" + CONFIRMATION_TOKEN + "'");
        }
    }

    private String toJson(Map<String, ?> data) {
        if (data == null || data.isEmpty()) return "{}";
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Checkpoint data is not serializable", e);
        }
    }
}
