package com.bidscope.api;

import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.error.ValidationException;
import com.bidscope.task.TaskEvent;
import com.bidscope.task.TaskKind;
import com.bidscope.task.TaskOrchestrator;
import com.bidscope.task.TaskResult;
import com.bidscope.task.TaskSnapshot;
import com.bidscope.task.TaskSubmission;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.util.List;

/**
 * Background task submission, polling, cancellation and progress streaming.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskOrchestrator orchestrator;

    public TaskController(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/{kind}")
    public ResponseEntity<TaskSubmission> submit(@PathVariable String kind, @RequestBody ContractQueryRequest request) {
        TaskKind taskKind;
        try {
            taskKind = TaskKind.fromValue(kind);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("kind", e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.submit(taskKind, request));
    }

    @GetMapping
    public List<TaskSnapshot> active() {
        return orchestrator.activeTasks();
    }

    @GetMapping("/{taskId}")
    public TaskSnapshot status(@PathVariable String taskId) {
        return orchestrator.status(taskId);
    }

    @GetMapping("/{taskId}/result")
    public TaskResult result(@PathVariable String taskId) {
        return orchestrator.result(taskId);
    }

    @GetMapping("/{taskId}/download")
    public ResponseEntity<Resource> download(@PathVariable String taskId) {
        Path file = orchestrator.exportFile(taskId);
        return ResponseEntity.ok()
            .contentType(ContractQueryController.TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"contracts_export_" + taskId + ".csv\"")
            .body(new FileSystemResource(file));
    }

    @DeleteMapping("/{taskId}")
    public TaskSnapshot cancel(@PathVariable String taskId) {
        return orchestrator.cancel(taskId);
    }

    @GetMapping(value = "/{taskId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<TaskEvent>> events(@PathVariable String taskId) {
        return orchestrator.events(taskId)
            .takeUntil(event -> event.getState().isTerminal())
            .map(event -> ServerSentEvent.builder(event).event("task_update").id(taskId).build());
    }
}
