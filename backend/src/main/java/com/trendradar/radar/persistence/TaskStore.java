package com.trendradar.radar.persistence;

import com.trendradar.radar.model.ExecutionOutcome;
import com.trendradar.radar.model.NewTask;
import com.trendradar.radar.model.RadarUser;
import com.trendradar.radar.model.TaskDefinition;
import com.trendradar.radar.model.TaskExecution;
import com.trendradar.radar.model.TaskStatus;
import com.trendradar.radar.model.TaskUpdate;

import java.util.List;
import java.util.Optional;

public interface TaskStore {

    RadarUser getOrCreateUser(String userId, String username, String email);

    TaskDefinition createTask(NewTask task);

    Optional<TaskDefinition> getTask(String taskId);

    List<TaskDefinition> listTasks(String userId, TaskStatus status);

    /**
     * @return false when no task has the id
     */
    boolean updateTask(String taskId, TaskUpdate update);

    boolean deleteTask(String taskId);

    /**
     * Stores one execution and prunes the oldest records of the task beyond the retention cap.
     */
    long recordExecution(String taskId, ExecutionOutcome outcome);

    List<TaskExecution> listExecutions(String taskId, int limit);

    Optional<TaskExecution> latestExecution(String taskId);
}
