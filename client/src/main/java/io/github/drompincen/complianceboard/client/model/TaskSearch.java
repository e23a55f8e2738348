package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.client.api.ClientSettings;
import io.github.drompincen.complianceboard.client.api.ComplianceApi;
import io.github.drompincen.complianceboard.client.state.LoadState;
import io.github.drompincen.complianceboard.protocol.api.PageResult;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.TaskQuery;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.Executor;

/** Dependency picker: searches the project's tasks, leaving out the task being edited. */
public class TaskSearch {

    private final Typeahead<ProjectTaskDto> typeahead;
    private volatile String excludedTaskId;

    public TaskSearch(ComplianceApi api, String projectId, ClientSettings settings, Scheduler scheduler, Executor ui) {
        this.typeahead = new Typeahead<>(
                q -> api.listTasks(projectId, TaskQuery.search(q))
                        .thenApply(PageResult::items)
                        .thenApply(this::withoutExcluded),
                settings.typeaheadLimit(), settings, scheduler, ui);
    }

    /** The task whose dependency is being picked; it never shows up in its own results. */
    public void exclude(String taskId) {
        this.excludedTaskId = taskId;
    }

    public void onInput(String text) {
        typeahead.onInput(text);
    }

    public void clear() {
        typeahead.clear();
    }

    public LoadState<List<ProjectTaskDto>> results() {
        return typeahead.results();
    }

    private List<ProjectTaskDto> withoutExcluded(List<ProjectTaskDto> tasks) {
        String excluded = excludedTaskId;
        if (tasks == null) return List.of();
        if (excluded == null) return tasks;
        return tasks.stream().filter(t -> !excluded.equals(t.id())).toList();
    }
}
