package com.agentflow.api.rest;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.ComplexityTier;
import com.agentflow.core.model.EscalationRecord;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.Verdict;
import com.agentflow.engine.orchestrator.TaskOrchestrator;
import com.agentflow.engine.orchestrator.TaskSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for submitting and following tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskOrchestrator orchestrator;

    public TaskController(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Submit a task. Execution starts in the background; poll the verdict for the outcome.
     */
    @PostMapping
    public ResponseEntity<SubmitTaskResponse> submitTask(@RequestBody SubmitTaskRequest request) {
        String taskId = orchestrator.submit(new TaskSubmission(
            request.taskId(), request.description(), request.declaredComplexity()));

        orchestrator.executeAsync(taskId).whenComplete((verdict, error) -> {
            if (error != null) {
                log.error("Execution of task {} failed unexpectedly", taskId, error);
            }
        });

        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new SubmitTaskResponse(taskId, orchestrator.state(taskId).stage().name()));
    }

    /**
     * Get the pipeline state of a task.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<PipelineState> getPipeline(@PathVariable String taskId) {
        return ResponseEntity.ok(orchestrator.state(taskId));
    }

    /**
     * Get the final verdict; 404 until the task has finished.
     */
    @GetMapping("/{taskId}/verdict")
    public ResponseEntity<Verdict> getVerdict(@PathVariable String taskId) {
        return orchestrator.verdict(taskId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new NotFoundException("Verdict", taskId));
    }

    /**
     * Get the hand-off record of an escalated or failed task.
     */
    @GetMapping("/{taskId}/escalation")
    public ResponseEntity<EscalationRecord> getEscalation(@PathVariable String taskId) {
        EscalationRecord escalation = orchestrator.verdict(taskId)
            .map(Verdict::escalation)
            .orElseThrow(() -> new NotFoundException("Escalation", taskId));
        return ResponseEntity.ok(escalation);
    }

    /**
     * Cancel a task.
     */
    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(
            @PathVariable String taskId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null && request.reason() != null ? request.reason() : "cancelled by request";
        boolean cancelled = orchestrator.cancel(taskId, reason);

        return ResponseEntity.ok(Map.of(
            "taskId", taskId,
            "cancelled", cancelled
        ));
    }

    // ========== DTOs ==========

    public record SubmitTaskRequest(
        String taskId,
        String description,
        ComplexityTier declaredComplexity
    ) {}

    public record SubmitTaskResponse(String taskId, String stage) {}

    public record CancelRequest(String reason) {}
}
