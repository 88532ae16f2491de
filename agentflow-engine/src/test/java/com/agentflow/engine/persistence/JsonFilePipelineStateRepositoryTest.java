package com.agentflow.engine.persistence;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.PersistenceException;
import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStage;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFilePipelineStateRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private JsonFilePipelineStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JsonFilePipelineStateRepository(dir.resolve("snapshots"));
    }

    private static PipelineState stateWithHistory(String taskId) {
        Task task = Task.create(taskId, "Fix the parser in src/parser.py", null, T0);
        AgentAttempt failed = AgentAttempt.failure(taskId + ":impl", 1, Strategy.DIRECT,
                T0.plusSeconds(1), T0.plusSeconds(5), "AGENT_FAILED", "SyntaxError at line 3",
                JsonNodeFactory.instance.objectNode().put("stderr", "line 3"))
            .withClassification(FailureSignature.SYNTAX_ERROR);
        AgentAttempt succeeded = AgentAttempt.success(taskId + ":impl", 2, Strategy.MECHANICAL_FIX,
            T0.plusSeconds(6), T0.plusSeconds(9), null, List.of("src/parser.py"));
        return PipelineState.initial(task, 3, T0)
            .withStage(TaskStage.ROUTING, "routing", T0)
            .withStage(TaskStage.IMPLEMENTING, "implementing", T0)
            .withAttempt(failed, T0.plusSeconds(5))
            .withAttempt(succeeded, T0.plusSeconds(9));
    }

    @Test
    @DisplayName("Snapshot round trip keeps history and derived views")
    void roundTrip() {
        PipelineState original = stateWithHistory("task-1");
        repository.save(original);

        PipelineState loaded = repository.findById("task-1").orElseThrow();

        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.retryCount()).isEqualTo(1);
        assertThat(loaded.failurePatterns()).containsExactly(FailureSignature.SYNTAX_ERROR);
        assertThat(loaded.touchedTargets()).containsExactly("src/parser.py");
        loaded.verifyIntegrity();
    }

    @Test
    @DisplayName("Saving again replaces the snapshot and leaves no temporary file")
    void overwrite() throws Exception {
        PipelineState state = stateWithHistory("task-1");
        repository.save(state);
        repository.save(state.withStage(TaskStage.COMPLETE, "done", T0.plusSeconds(10)));

        assertThat(repository.findById("task-1").orElseThrow().stage()).isEqualTo(TaskStage.COMPLETE);
        try (var files = Files.list(repository.directory())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("task-1.json");
        }
    }

    @Test
    @DisplayName("Active ids exclude terminal pipelines")
    void activeIds() {
        repository.save(stateWithHistory("running"));
        repository.save(stateWithHistory("done").withStage(TaskStage.COMPLETE, "done", T0));

        assertThat(repository.findActiveTaskIds()).containsExactly("running");
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Archived pipelines are listed by archive time")
    void archivedSince() {
        PipelineState done = stateWithHistory("done").withStage(TaskStage.COMPLETE, "done", T0);
        repository.save(done.archived(T0.plusSeconds(60)));
        repository.save(stateWithHistory("old").withStage(TaskStage.FAILED, "failed", T0).archived(T0));

        assertThat(repository.findArchivedSince(T0.plusSeconds(30)))
            .extracting(PipelineState::taskId)
            .containsExactly("done");
    }

    @Test
    @DisplayName("Unreadable snapshots raise CorruptStateException but still count as active")
    void corruptSnapshot() throws Exception {
        Files.writeString(repository.directory().resolve("broken.json"), "{\"taskId\": \"broken\", \"stage\": ");

        assertThatThrownBy(() -> repository.findById("broken"))
            .isInstanceOf(CorruptStateException.class);
        assertThat(repository.findActiveTaskIds()).contains("broken");
        assertThat(repository.findArchivedSince(Instant.EPOCH)).isEmpty();
    }

    @Test
    @DisplayName("Missing snapshots are empty, not errors")
    void missing() {
        assertThat(repository.findById("nope")).isEmpty();
    }

    @Test
    @DisplayName("Ids that resolve outside the snapshot directory are refused")
    void idsCannotEscapeDirectory() throws Exception {
        PipelineState escaping = stateWithHistory("../escaped");

        assertThatThrownBy(() -> repository.save(escaping))
            .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> repository.findById("../escaped"))
            .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> repository.findById("nested/child"))
            .isInstanceOf(PersistenceException.class);

        assertThat(dir.resolve("escaped.json")).doesNotExist();
        assertThat(dir.resolve("escaped.json.tmp")).doesNotExist();
        assertThat(repository.count()).isZero();
    }
}
