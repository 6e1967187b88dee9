package com.dive.orchestrator.api;

import com.dive.orchestrator.api.dto.CheckpointResponse;
import com.dive.orchestrator.api.dto.DeploymentResponse;
import com.dive.orchestrator.api.dto.ErrorResponse;
import com.dive.orchestrator.api.dto.StepResponse;
import com.dive.orchestrator.api.dto.TransitionResponse;
import com.dive.orchestrator.error.ConfigurationException;
import com.dive.orchestrator.error.ErrorClassifier;
import com.dive.orchestrator.error.LockContentionException;
import com.dive.orchestrator.model.Deployment;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;
import com.dive.orchestrator.pipeline.PipelineExecutor;
import com.dive.orchestrator.pipeline.PipelineResult;
import com.dive.orchestrator.pipeline.PipelineStatus;
import com.dive.orchestrator.repository.DeploymentStepRepository;
import com.dive.orchestrator.service.AdvisoryLockManager;
import com.dive.orchestrator.service.CheckpointReport;
import com.dive.orchestrator.service.CheckpointStore;
import com.dive.orchestrator.service.CheckpointValidation;
import com.dive.orchestrator.service.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for one deployment instance.
 *
 * GET    /instances                               all known instances
 * GET    /instances/{code}/state                  current state and duration
 * GET    /instances/{code}/history                transition log, newest first
 * GET    /instances/{code}/steps                  phase attempts
 * GET    /instances/{code}/errors                 recorded errors, newest first
 * POST   /instances/{code}/pipeline?mode=deploy   run (or resume) the pipeline
 * GET    /instances/{code}/checkpoints            completed phases
 * GET    /instances/{code}/checkpoints/validate   prefix check
 * GET    /instances/{code}/checkpoints/report     JSON report for external tooling
 * DELETE /instances/{code}/checkpoints            clear all (needs confirm)
 * DELETE /instances/{code}/checkpoints/{phase}    clear one (needs confirm)
 * POST   /instances/{code}/rollback               restore the newest checkpoint
 * POST   /instances/{code}/reset                  clear checkpoints, state back to UNKNOWN
 * DELETE /instances/{code}/lock                   force-release a stale lock
 */
@RestController
@RequestMapping("/instances")
public class InstanceController {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private final StateStore               stateStore;
    private final CheckpointStore          checkpointStore;
    private final PipelineExecutor         executor;
    private final ErrorClassifier          classifier;
    private final AdvisoryLockManager      lockManager;
    private final DeploymentStepRepository stepRepo;

    public InstanceController(StateStore stateStore,
                              CheckpointStore checkpointStore,
                              PipelineExecutor executor,
                              ErrorClassifier classifier,
                              AdvisoryLockManager lockManager,
                              DeploymentStepRepository stepRepo) {
        this.stateStore      = stateStore;
        this.checkpointStore = checkpointStore;
        this.executor        = executor;
        this.classifier      = classifier;
        this.lockManager     = lockManager;
        this.stepRepo        = stepRepo;
    }

    // ------------------------------------------------------------------
    // State
    // ------------------------------------------------------------------

    @GetMapping
    public List<DeploymentResponse> list() {
        return stateStore.instances().stream()
                .map(this::toResponse)
                .toList();
    }

    /** Never 404: an instance without a state row is reported as UNKNOWN. */
    @GetMapping("/{code}/state")
    public DeploymentResponse state(@PathVariable String code) {
        String instance = normalize(code);
        return stateStore.find(instance)
                .map(this::toResponse)
                .orElseGet(() -> DeploymentResponse.unknown(instance, lockManager.isHeld(instance)));
    }

    @GetMapping("/{code}/history")
    public List<TransitionResponse> history(@PathVariable String code,
                                            @RequestParam(defaultValue = "20") int limit) {
        return stateStore.history(normalize(code), limit).stream()
                .map(TransitionResponse::from)
                .toList();
    }

    @GetMapping("/{code}/steps")
    public List<StepResponse> steps(@PathVariable String code) {
        return stepRepo.findByInstanceCodeOrderByStartedAtAscIdAsc(normalize(code)).stream()
                .map(StepResponse::from)
                .toList();
    }

    @GetMapping("/{code}/errors")
    public List<ErrorResponse> errors(@PathVariable String code,
                                      @RequestParam(defaultValue = "20") int limit) {
        return classifier.recent(normalize(code), limit).stream()
                .map(ErrorResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    /**
     * Run the pipeline synchronously and return its result.
     *
     * HTTP 200 for every run that reached a verdict, including failed and
     * rolled-back ones; the body carries the status and remediation.
     * HTTP 409 when another run holds the lock or the instance needs a reset.
     *
     * Example:
     *   curl -X POST 'http://localhost:8090/instances/fra/pipeline?mode=up'
     */
    @PostMapping("/{code}/pipeline")
    public ResponseEntity<PipelineResult> runPipeline(@PathVariable String code,
                                                      @RequestParam(defaultValue = "deploy") String mode) {
        PipelineMode pipelineMode;
        try {
            pipelineMode = PipelineMode.parse(mode);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        PipelineResult result = executor.run(normalize(code), pipelineMode);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @PostMapping("/{code}/rollback")
    public ResponseEntity<PipelineResult> rollback(@PathVariable String code) {
        PipelineResult result = executor.forceRollback(normalize(code));
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @PostMapping("/{code}/reset")
    public Map<String, Object> reset(@PathVariable String code,
                                     @RequestParam(required = false) String confirm) {
        String instance = normalize(code);
        try {
            long cleared = executor.reset(instance, confirm);
            return Map.of("instanceCode", instance, "checkpointsCleared", cleared,
                    "state", stateStore.getState(instance).name());
        } catch (LockContentionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{code}/lock")
    public Map<String, Object> releaseLock(@PathVariable String code) {
        String instance = normalize(code);
        boolean released = lockManager.forceRelease(instance);
        log.warn("Operator force-released lock for {} (held: {})", instance, released);
        return Map.of("instanceCode", instance, "released", released);
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @GetMapping("/{code}/checkpoints")
    public List<CheckpointResponse> checkpoints(@PathVariable String code) {
        return checkpointStore.checkpoints(normalize(code)).stream()
                .map(CheckpointResponse::from)
                .toList();
    }

    @GetMapping("/{code}/checkpoints/validate")
    public CheckpointValidation validate(@PathVariable String code) {
        return checkpointStore.validateState(normalize(code));
    }

    @GetMapping("/{code}/checkpoints/report")
    public CheckpointReport report(@PathVariable String code) {
        return checkpointStore.report(normalize(code));
    }

    @DeleteMapping("/{code}/checkpoints")
    public Map<String, Object> clearAll(@PathVariable String code,
                                        @RequestParam(required = false) String confirm) {
        String instance = normalize(code);
        try {
            return Map.of("instanceCode", instance, "cleared", checkpointStore.clearAll(instance, confirm));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{code}/checkpoints/{phase}")
    public Map<String, Object> clearPhase(@PathVariable String code,
                                          @PathVariable String phase,
                                          @RequestParam(required = false) String confirm) {
        String instance = normalize(code);
        try {
            Phase parsed = Phase.parse(phase);
            boolean cleared = checkpointStore.clearPhase(instance, parsed, confirm);
            return Map.of("instanceCode", instance, "phase", parsed.name(), "cleared", cleared);
        } catch (ConfigurationException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DeploymentResponse toResponse(Deployment d) {
        return DeploymentResponse.from(d,
                stateStore.getDuration(d.getInstanceCode()).toSeconds(),
                lockManager.isHeld(d.getInstanceCode()));
    }

    private static String normalize(String code) {
        try {
            return StateStore.normalize(code);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    private static HttpStatus statusFor(PipelineResult result) {
        return result.status() == PipelineStatus.LOCK_CONTENTION
                || result.status() == PipelineStatus.REQUIRES_RESET
                ? HttpStatus.CONFLICT
                : HttpStatus.OK;
    }
}
