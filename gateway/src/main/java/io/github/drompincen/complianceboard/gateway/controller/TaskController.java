package io.github.drompincen.complianceboard.gateway.controller;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.task.ProjectTaskService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects/{projectId}/tasks")
public class TaskController {

    private final ProjectTaskService taskService;

    public TaskController(ProjectTaskService taskService) {
        this.taskService = taskService;
    }

    /** A {@code q} parameter, even an empty one, switches to the bounded search result set. */
    @GetMapping
    public PageResult<ProjectTaskDto> list(@PathVariable String projectId,
                                           @RequestParam(required = false) Integer limit,
                                           @RequestParam(required = false) Integer offset,
                                           @RequestParam(required = false) String status,
                                           @RequestParam(required = false) String q) {
        return taskService.list(projectId,
                new TaskQuery(limit, offset, ProjectTaskDto.TaskStatus.fromWire(status), q));
    }

    @PostMapping
    public ResponseEntity<?> create(@PathVariable String projectId, @RequestBody CreateTaskRequest request) {
        return ApiResponses.of(taskService.create(projectId, request, ChangeEvent.Origin.USER));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<ProjectTaskDto> get(@PathVariable String projectId, @PathVariable String taskId) {
        return taskService.get(projectId, taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<?> update(@PathVariable String projectId, @PathVariable String taskId,
                                    @RequestBody UpdateTaskRequest request) {
        return ApiResponses.of(taskService.update(projectId, taskId, request, ChangeEvent.Origin.USER),
                ProjectTaskService.NOT_FOUND);
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable String taskId) {
        return taskService.delete(projectId, taskId, ChangeEvent.Origin.USER)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /** The task this one depends on; 404 when there is no live dependency. */
    @GetMapping("/{taskId}/dependency")
    public ResponseEntity<ProjectTaskDto> dependency(@PathVariable String projectId, @PathVariable String taskId) {
        return taskService.graph(projectId).resolve(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
