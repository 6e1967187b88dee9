package com.dive.orchestrator.service;

import com.dive.orchestrator.model.Deployment;
import com.dive.orchestrator.model.DeploymentState;
import com.dive.orchestrator.model.StateTransition;
import com.dive.orchestrator.repository.DeploymentRepository;
import com.dive.orchestrator.repository.StateTransitionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Single source of truth for "what state is instance X in".
 *
 * Every mutation writes the live row and appends exactly one
 * {@link StateTransition} in the same transaction, so the log and the live
 * row can never disagree. Instance codes are normalized to lower case.
 */
@Service
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    /** Instance codes key database rows (VARCHAR(16)) and name directories. */
    private static final Pattern INSTANCE_CODE = Pattern.compile("[a-z0-9][a-z0-9-]{0,15}");

    private final DeploymentRepository      deploymentRepo;
    private final StateTransitionRepository transitionRepo;
    private final ObjectMapper              objectMapper;
    private final Clock                     clock;

    public StateStore(DeploymentRepository deploymentRepo,
                      StateTransitionRepository transitionRepo,
                      ObjectMapper objectMapper,
                      Clock clock) {
        this.deploymentRepo = deploymentRepo;
        this.transitionRepo = transitionRepo;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------

    public void setState(String instanceCode, DeploymentState state) {
        setState(instanceCode, state, null, null);
    }

    /**
     * Move an instance to {@code state}.
     *
     * The live row is read with a row lock, so two writers for the same
     * instance append transitions in a consistent order. A first write for
     * an instance records UNKNOWN as the previous state.
     */
    @Transactional
    public void setState(String instanceCode, DeploymentState state,
                         String reason, Map<String, ?> metadata) {
        if (state == DeploymentState.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN is only reachable through reset()");
        }
        String code = normalize(instanceCode);
        Instant now = clock.instant();

        Deployment deployment = deploymentRepo.lockByInstanceCode(code)
                .orElseGet(() -> new Deployment(code, now));
        DeploymentState previous = deployment.getState();
        String metadataJson = toJson(metadata);

        deployment.setState(state);
        deployment.setMetadata(metadataJson);
        deployment.setUpdatedAt(now);
        deploymentRepo.save(deployment);

        transitionRepo.save(new StateTransition(code, previous, state, reason, metadataJson, now));
        log.info("Instance {} state {} -> {}{}", code, previous, state,
                reason != null ? " (" + reason + ")" : "");
    }

    /**
     * Move the instance back to the from_state of its latest transition.
     * Recorded as a new transition; the log itself is never edited.
     *
     * @return the state moved to, or empty when the instance has no history
     */
    @Transactional
    public Optional<DeploymentState> rollbackState(String instanceCode, String reason) {
        String code = normalize(instanceCode);
        Optional<StateTransition> last = transitionRepo.findFirstByInstanceCodeOrderByOccurredAtDescIdDesc(code);
        if (last.isEmpty()) {
            log.warn("No transitions recorded for {}; nothing to roll back", code);
            return Optional.empty();
        }
        DeploymentState target = last.get().getFromState();
        Instant now = clock.instant();

        Deployment deployment = deploymentRepo.lockByInstanceCode(code)
                .orElseGet(() -> new Deployment(code, now));
        DeploymentState current = deployment.getState();

        deployment.setState(target);
        deployment.setUpdatedAt(now);
        deploymentRepo.save(deployment);

        transitionRepo.save(new StateTransition(code, current, target,
                reason != null ? reason : "rollback", null, now));
        log.warn("Instance {} state rolled back {} -> {}", code, current, target);
        return Optional.of(target);
    }

    /**
     * Return the instance to UNKNOWN so a pipeline may run again after
     * FAILED or ROLLED_BACK. Recorded as a transition like any other change.
     */
    @Transactional
    public void reset(String instanceCode, String reason) {
        String code = normalize(instanceCode);
        Instant now = clock.instant();
        Deployment deployment = deploymentRepo.lockByInstanceCode(code).orElse(null);
        if (deployment == null || deployment.getState() == DeploymentState.UNKNOWN) {
            return;
        }
        DeploymentState previous = deployment.getState();
        deployment.setState(DeploymentState.UNKNOWN);
        deployment.setMetadata(null);
        deployment.setUpdatedAt(now);
        deploymentRepo.save(deployment);

        transitionRepo.save(new StateTransition(code, previous, DeploymentState.UNKNOWN, reason, null, now));
        log.warn("Instance {} reset {} -> UNKNOWN ({})", code, previous, reason);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Current state, or {@link DeploymentState#UNKNOWN} for an instance never deployed. */
    @Transactional(readOnly = true)
    public DeploymentState getState(String instanceCode) {
        return deploymentRepo.findById(normalize(instanceCode))
                .map(Deployment::getState)
                .orElse(DeploymentState.UNKNOWN);
    }

    @Transactional(readOnly = true)
    public Optional<Deployment> find(String instanceCode) {
        return deploymentRepo.findById(normalize(instanceCode));
    }

    @Transactional(readOnly = true)
    public List<Deployment> instances() {
        return deploymentRepo.findAllByOrderByInstanceCodeAsc();
    }

    /**
     * Time between the first transition and the latest one when the latest
     * is terminal, or until now while the deployment is still running.
     * Zero for an instance with no history.
     */
    @Transactional(readOnly = true)
    public Duration getDuration(String instanceCode) {
        String code = normalize(instanceCode);
        Optional<StateTransition> first = transitionRepo.findFirstByInstanceCodeOrderByOccurredAtAscIdAsc(code);
        if (first.isEmpty()) return Duration.ZERO;

        StateTransition last = transitionRepo.findFirstByInstanceCodeOrderByOccurredAtDescIdDesc(code)
                .orElseThrow();
        Instant end = last.getToState().isTerminal() ? last.getOccurredAt() : clock.instant();
        return Duration.between(first.get().getOccurredAt(), end);
    }

    /** Most recent transitions first. */
    @Transactional(readOnly = true)
    public List<StateTransition> history(String instanceCode, int limit) {
        return transitionRepo.findByInstanceCodeOrderByOccurredAtDescIdDesc(
                normalize(instanceCode), PageRequest.of(0, Math.max(1, limit)));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    public static String normalize(String instanceCode) {
        if (instanceCode == null || instanceCode.isBlank()) {
            throw new IllegalArgumentException("Instance code is required");
        }
        String code = instanceCode.trim().toLowerCase(Locale.ROOT);
        if (!INSTANCE_CODE.matcher(code).matches()) {
            throw new IllegalArgumentException("Invalid instance code '" + instanceCode.trim()
                    + "': expected 1-16 letters, digits or '-', starting with a letter or digit");
        }
        return code;
    }

    private String toJson(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("State metadata is not serializable", e);
        }
    }
}
