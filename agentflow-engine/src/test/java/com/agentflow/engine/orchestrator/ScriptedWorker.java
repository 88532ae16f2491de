package com.agentflow.engine.orchestrator;

import com.agentflow.core.model.Strategy;
import com.agentflow.worker.Worker;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerRequest;
import com.agentflow.worker.WorkerResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test worker that answers according to a script and records every request it receives.
 */
final class ScriptedWorker implements Worker {

    @FunctionalInterface
    interface Script {
        WorkerResult respond(WorkerRequest request) throws WorkerException;
    }

    private final Script script;
    private final List<WorkerRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    ScriptedWorker(Script script) {
        this.script = script;
    }

    static ScriptedWorker succeeding() {
        return new ScriptedWorker(request -> WorkerResult.success(null, request.getTargets()));
    }

    static ScriptedWorker failing(String message) {
        return new ScriptedWorker(request -> WorkerResult.failure("AGENT_FAILED", message));
    }

    @Override
    public WorkerResult execute(WorkerRequest request) throws WorkerException {
        requests.add(request);
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            return script.respond(request);
        } finally {
            running.decrementAndGet();
        }
    }

    List<WorkerRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    List<Strategy> strategiesFor(String subtaskId) {
        return requests().stream()
            .filter(r -> r.getSubtaskId().equals(subtaskId))
            .map(WorkerRequest::getStrategy)
            .toList();
    }

    int maxConcurrent() {
        return maxRunning.get();
    }
}
