package io.github.drompincen.complianceboard.runtime.task;

import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;

import java.util.*;

/**
 * Read view over the single depends-on edge of each task. Edges are advisory: a task may be completed while
 * its dependency is still open. New edges that would close a cycle are rejected.
 */
public class TaskDependencyGraph {

    public static final String SELF_DEPENDENCY = "Task cannot depend on itself";
    public static final String DEPENDENCY_NOT_FOUND = "Dependency task not found";
    public static final String CYCLE = "Dependency would create a cycle";

    private final Map<String, ProjectTaskDto> tasks;

    public TaskDependencyGraph(Collection<ProjectTaskDto> tasks) {
        Map<String, ProjectTaskDto> byId = new LinkedHashMap<>();
        for (ProjectTaskDto task : tasks) byId.put(task.id(), task);
        this.tasks = Collections.unmodifiableMap(byId);
    }

    /** The live task this one depends on; empty when there is no edge or it points at a deleted task. */
    public Optional<ProjectTaskDto> resolve(String taskId) {
        ProjectTaskDto task = tasks.get(taskId);
        if (task == null || task.dependsOnTaskId() == null) return Optional.empty();
        return Optional.ofNullable(tasks.get(task.dependsOnTaskId()));
    }

    public List<ProjectTaskDto> dependents(String taskId) {
        return tasks.values().stream()
                .filter(t -> taskId.equals(t.dependsOnTaskId()))
                .toList();
    }

    /** True when following depends-on edges from {@code dependsOnId} leads back to {@code taskId}. */
    public boolean wouldCreateCycle(String taskId, String dependsOnId) {
        Set<String> seen = new HashSet<>();
        String current = dependsOnId;
        while (current != null && seen.add(current)) {
            if (current.equals(taskId)) return true;
            ProjectTaskDto next = tasks.get(current);
            current = next != null ? next.dependsOnTaskId() : null;
        }
        return false;
    }

    /** Why {@code taskId -> dependsOnId} cannot be added, or empty when it can. {@code taskId} may be null for a new task. */
    public Optional<String> validateEdge(String taskId, String dependsOnId) {
        if (taskId != null && taskId.equals(dependsOnId)) return Optional.of(SELF_DEPENDENCY);
        if (!tasks.containsKey(dependsOnId)) return Optional.of(DEPENDENCY_NOT_FOUND);
        if (taskId != null && wouldCreateCycle(taskId, dependsOnId)) return Optional.of(CYCLE);
        return Optional.empty();
    }

    public boolean isBlocked(String taskId) {
        return resolve(taskId)
                .map(dep -> dep.status() != ProjectTaskDto.TaskStatus.COMPLETED)
                .orElse(false);
    }
}
