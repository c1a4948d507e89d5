package dev.relaygate.controller;

import dev.relaygate.dto.request.ChatRequest;
import dev.relaygate.dto.request.QueueJobRequest;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.queue.JobHandle;
import dev.relaygate.queue.JobSnapshot;
import dev.relaygate.queue.QueueMetrics;
import dev.relaygate.queue.RequestDispatcher;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/queue")
public class QueueController {

    private final RequestDispatcher dispatcher;

    public QueueController(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/jobs")
    public ResponseEntity<Map<String, Object>> enqueue(@Valid @RequestBody QueueJobRequest body) {
        List<AiRequest> requests = body.requests().stream().map(ChatRequest::toAiRequest).toList();
        JobHandle handle = dispatcher.enqueue(body.provider(), body.model(), requests, body.priority());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("success", true, "job_id", handle.jobId(), "status", "queued"));
    }

    @GetMapping("/jobs/{id}")
    public JobSnapshot status(@PathVariable UUID id) {
        return dispatcher.getStatus(id).orElseThrow(() -> new NotFoundException("Job", id));
    }

    @DeleteMapping("/jobs/{id}")
    public Map<String, Object> cancel(@PathVariable UUID id) {
        boolean cancelled = dispatcher.cancel(id);
        return Map.of("success", cancelled, "job_id", id,
                "status", dispatcher.getStatus(id).map(s -> s.state().wireName()).orElse("unknown"));
    }

    @GetMapping("/metrics")
    public QueueMetrics metrics() {
        return dispatcher.metrics();
    }

    @PostMapping("/pause")
    public Map<String, Object> pause() {
        dispatcher.pause();
        return Map.of("success", true, "paused", true);
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        dispatcher.resume();
        return Map.of("success", true, "paused", false);
    }
}
