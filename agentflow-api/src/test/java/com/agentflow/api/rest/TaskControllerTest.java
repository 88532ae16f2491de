package com.agentflow.api.rest;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.InvalidTaskException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.EscalationRecord;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.SubtaskStatus;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStage;
import com.agentflow.core.model.Verdict;
import com.agentflow.engine.orchestrator.TaskOrchestrator;
import com.agentflow.engine.orchestrator.TaskSubmission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    private static final Instant T0 = Instant.parse("2024-06-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaskOrchestrator orchestrator;

    private static PipelineState submitted(String taskId) {
        return PipelineState.initial(Task.create(taskId, "Update the README", null, T0), 3, T0);
    }

    @Test
    @DisplayName("Submitting a task starts execution and answers 202 with the pipeline id")
    void submitTask() throws Exception {
        when(orchestrator.submit(any(TaskSubmission.class))).thenReturn("task-1");
        when(orchestrator.executeAsync("task-1")).thenReturn(new CompletableFuture<>());
        when(orchestrator.state("task-1")).thenReturn(submitted("task-1"));

        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskId\":\"task-1\",\"description\":\"Update the README\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.taskId").value("task-1"))
            .andExpect(jsonPath("$.stage").value("SUBMITTED"));

        verify(orchestrator).submit(new TaskSubmission("task-1", "Update the README", null));
        verify(orchestrator).executeAsync("task-1");
    }

    @Test
    @DisplayName("An invalid task is rejected with 400 and its error code")
    void rejectsInvalidTask() throws Exception {
        when(orchestrator.submit(any(TaskSubmission.class)))
            .thenThrow(new InvalidTaskException("description must not be empty"));

        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(InvalidTaskException.ERROR_CODE))
            .andExpect(jsonPath("$.message").value("Invalid task: description must not be empty"));
    }

    @Test
    @DisplayName("Unknown pipelines answer 404")
    void unknownPipeline() throws Exception {
        when(orchestrator.state("nope")).thenThrow(new NotFoundException("PipelineState", "nope"));

        mockMvc.perform(get("/api/v1/tasks/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value(NotFoundException.ERROR_CODE));
    }

    @Test
    @DisplayName("Corrupt persisted state answers 409")
    void corruptPipeline() throws Exception {
        when(orchestrator.state("bad-1")).thenThrow(new CorruptStateException("bad-1", "attempt numbers not contiguous"));

        mockMvc.perform(get("/api/v1/tasks/bad-1"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value(CorruptStateException.ERROR_CODE))
            .andExpect(jsonPath("$.taskId").value("bad-1"));
    }

    @Test
    @DisplayName("Pipeline state is returned as recorded")
    void getPipeline() throws Exception {
        when(orchestrator.state("task-1")).thenReturn(submitted("task-1"));

        mockMvc.perform(get("/api/v1/tasks/task-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.taskId").value("task-1"))
            .andExpect(jsonPath("$.stage").value("SUBMITTED"))
            .andExpect(jsonPath("$.maxRetries").value(3));
    }

    @Test
    @DisplayName("The verdict is 404 until the pipeline finishes")
    void verdict() throws Exception {
        when(orchestrator.verdict("running")).thenReturn(Optional.empty());
        when(orchestrator.verdict("done")).thenReturn(Optional.of(new Verdict(
            "done", TaskStage.COMPLETE, Map.of("done:impl", SubtaskStatus.SUCCEEDED), List.of(),
            1, null, "completed", T0)));

        mockMvc.perform(get("/api/v1/tasks/running/verdict"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/tasks/done/verdict"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stage").value("COMPLETE"))
            .andExpect(jsonPath("$.attemptCount").value(1))
            .andExpect(jsonPath("$['subtaskStatuses']['done:impl']").value("SUCCEEDED"));
    }

    @Test
    @DisplayName("Escalated pipelines expose their hand-off record")
    void escalation() throws Exception {
        EscalationRecord record = new EscalationRecord("esc-1", "Fix src/a.py", "esc-1:impl",
            "retry ceiling reached", List.of(), List.of(FailureSignature.TEST_FAILURE), List.of(),
            FailureSignature.TEST_FAILURE.nextStepHint(), T0);
        when(orchestrator.verdict("esc-1")).thenReturn(Optional.of(new Verdict(
            "esc-1", TaskStage.ESCALATED, Map.of("esc-1:impl", SubtaskStatus.FAILED), List.of(),
            3, record, "escalated", T0)));
        when(orchestrator.verdict("ok-1")).thenReturn(Optional.of(new Verdict(
            "ok-1", TaskStage.COMPLETE, Map.of(), List.of(), 1, null, "completed", T0)));

        mockMvc.perform(get("/api/v1/tasks/esc-1/escalation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.failedSubtaskId").value("esc-1:impl"))
            .andExpect(jsonPath("$.recommendedNextStep").value(FailureSignature.TEST_FAILURE.nextStepHint()));
        mockMvc.perform(get("/api/v1/tasks/ok-1/escalation"))
            .andExpect(status().isNotFound());
        when(orchestrator.verdict("cx-1")).thenReturn(Optional.of(new Verdict(
            "cx-1", TaskStage.CANCELLED, Map.of(), List.of(), 0, null, "cancelled by request", T0)));
        mockMvc.perform(get("/api/v1/tasks/cx-1/escalation"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value(NotFoundException.ERROR_CODE));
    }

    @Test
    @DisplayName("Cancelling passes the reason through and reports whether it took effect")
    void cancel() throws Exception {
        when(orchestrator.cancel("task-1", "superseded")).thenReturn(true);
        when(orchestrator.cancel("task-2", "cancelled by request")).thenReturn(false);

        mockMvc.perform(post("/api/v1/tasks/task-1/cancel")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"superseded\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true));
        mockMvc.perform(post("/api/v1/tasks/task-2/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false));

        verify(orchestrator).cancel("task-2", "cancelled by request");
    }
}
