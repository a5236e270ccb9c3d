package com.trendradar.radar.api;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.KeywordGroup;
import com.trendradar.radar.model.NewTask;
import com.trendradar.radar.model.ReportMode;
import com.trendradar.radar.model.TaskDefinition;
import com.trendradar.radar.model.TaskExecution;
import com.trendradar.radar.model.TaskStatus;
import com.trendradar.radar.model.TaskUpdate;
import com.trendradar.radar.persistence.TaskStore;
import com.trendradar.radar.service.RadarSearchService;
import com.trendradar.radar.service.RunValidationException;
import com.trendradar.radar.service.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {
    private static final int RECENT_EXECUTIONS = 5;
    private static final int MAX_EXECUTION_LIMIT = 100;

    private final TaskStore taskStore;
    private final RadarSearchService searchService;
    private final RadarProperties properties;

    public TaskController(TaskStore taskStore, RadarSearchService searchService, RadarProperties properties) {
        this.taskStore = taskStore;
        this.searchService = searchService;
        this.properties = properties;
    }

    @GetMapping
    public Map<String, Object> listTasks(
        @RequestParam(name = "userId", required = false) String userId,
        @RequestParam(name = "status", required = false) String status
    ) {
        String owner = requireUserId(userId);
        taskStore.getOrCreateUser(owner, null, null);
        List<TaskDefinition> tasks = taskStore.listTasks(owner, parseStatus(status));
        return Map.of("success", true, "tasks", tasks, "total", tasks.size());
    }

    @GetMapping("/{taskId}")
    public Map<String, Object> getTask(@PathVariable String taskId) {
        TaskDefinition task = requireTask(taskId);
        List<TaskExecution> executions = taskStore.listExecutions(taskId, RECENT_EXECUTIONS);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("task", task);
        body.put("lastExecution", taskStore.latestExecution(taskId).orElse(null));
        body.put("recentExecutions", executions);
        return body;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createTask(@RequestBody(required = false) TaskApiRequest request) {
        if (request == null) {
            throw new RunValidationException("request body is required");
        }
        String owner = requireUserId(request.userId());
        if (request.name() == null || request.name().isBlank() || !hasKeywords(request.keywords())) {
            throw new RunValidationException("name and keywords are required");
        }
        taskStore.getOrCreateUser(owner, null, null);
        TaskDefinition created = taskStore.createTask(new NewTask(
            request.name().trim(),
            owner,
            request.keywords(),
            request.filters(),
            request.platforms(),
            parseMode(request.reportMode()),
            request.schedule(),
            request.expandKeywords(),
            request.description()
        ));
        return Map.of("success", true, "task", created);
    }

    @PutMapping("/{taskId}")
    public Map<String, Object> updateTask(
        @PathVariable String taskId,
        @RequestBody(required = false) TaskApiRequest request
    ) {
        if (request == null) {
            throw new RunValidationException("request body is required");
        }
        if (request.keywords() != null && !hasKeywords(request.keywords())) {
            throw new RunValidationException("keywords must not be empty");
        }
        TaskUpdate update = new TaskUpdate(
            request.name(),
            request.keywords(),
            request.filters(),
            request.platforms(),
            parseMode(request.reportMode()),
            request.schedule(),
            request.expandKeywords(),
            parseStatus(request.status()),
            request.description()
        );
        if (!update.isEmpty() && !taskStore.updateTask(taskId, update)) {
            throw new TaskNotFoundException(taskId);
        }
        return Map.of("success", true, "task", requireTask(taskId));
    }

    @DeleteMapping("/{taskId}")
    public Map<String, Object> deleteTask(@PathVariable String taskId) {
        if (!taskStore.deleteTask(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        return Map.of("success", true, "taskId", taskId);
    }

    @PostMapping("/{taskId}/execute")
    public SearchResponse executeTask(@PathVariable String taskId) {
        return SearchResponse.from(searchService.executeTask(taskId), taskId);
    }

    @GetMapping("/{taskId}/executions")
    public Map<String, Object> listExecutions(
        @PathVariable String taskId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        requireTask(taskId);
        int safeLimit = limit == null
            ? properties.getTasks().getDefaultExecutionLimit()
            : Math.max(1, Math.min(MAX_EXECUTION_LIMIT, limit));
        List<TaskExecution> executions = taskStore.listExecutions(taskId, safeLimit);
        return Map.of("success", true, "taskId", taskId, "executions", executions, "total", executions.size());
    }

    private TaskDefinition requireTask(String taskId) {
        return taskStore.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new RunValidationException("userId is required");
        }
        return userId.trim();
    }

    private static boolean hasKeywords(List<KeywordGroup> keywords) {
        return keywords != null && keywords.stream().anyMatch(group -> group != null && !group.isEmpty());
    }

    private static ReportMode parseMode(String code) {
        try {
            return ReportMode.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new RunValidationException("reportMode must be one of daily, current, incremental");
        }
    }

    private static TaskStatus parseStatus(String code) {
        try {
            return TaskStatus.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new RunValidationException("status must be one of active, paused, archived");
        }
    }
}
