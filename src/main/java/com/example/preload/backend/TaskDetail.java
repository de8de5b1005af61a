package com.example.preload.backend;

import java.util.List;
import java.util.Objects;

/**
 * View state behind a task's detail sheet: the AI strategy, the duration estimate and suggested
 * learning resources. A placeholder has only the task id.
 */
public class TaskDetail {

    private final String taskId;
    private final String strategy;
    private final Integer estimatedMinutes;
    private final List<String> resources;
    private final boolean placeholder;

    public TaskDetail(String taskId, String strategy, Integer estimatedMinutes, List<String> resources) {
        this(taskId, strategy, estimatedMinutes, resources, false);
    }

    private TaskDetail(String taskId, String strategy, Integer estimatedMinutes, List<String> resources,
                       boolean placeholder) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.strategy = strategy;
        this.estimatedMinutes = estimatedMinutes;
        this.resources = resources == null ? List.of() : List.copyOf(resources);
        this.placeholder = placeholder;
    }

    public static TaskDetail placeholder(String taskId) {
        return new TaskDetail(taskId, null, null, List.of(), true);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getStrategy() {
        return strategy;
    }

    public Integer getEstimatedMinutes() {
        return estimatedMinutes;
    }

    public List<String> getResources() {
        return resources;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    @Override
    public String toString() {
        return "TaskDetail{taskId=" + taskId + ", placeholder=" + placeholder + "}";
    }
}
