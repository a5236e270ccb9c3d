package com.trendradar.radar.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.ExecutionOutcome;
import com.trendradar.radar.model.KeywordGroup;
import com.trendradar.radar.model.NewTask;
import com.trendradar.radar.model.RadarUser;
import com.trendradar.radar.model.ReportMode;
import com.trendradar.radar.model.TaskDefinition;
import com.trendradar.radar.model.TaskExecution;
import com.trendradar.radar.model.TaskStatus;
import com.trendradar.radar.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);
    private static final TypeReference<List<KeywordGroup>> KEYWORD_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RadarProperties properties;

    public JdbcTaskStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, RadarProperties properties) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public RadarUser getOrCreateUser(String userId, String username, String email) {
        RadarUser existing = findUser(userId);
        if (existing != null) {
            return existing;
        }
        Instant now = Instant.now();
        String safeUsername = username == null || username.isBlank() ? userId : username.trim();
        try {
            jdbc.update(
                """
                    INSERT INTO users (id, username, email, created_at, updated_at)
                    VALUES (:id, :username, :email, :now, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("id", userId)
                    .addValue("username", safeUsername)
                    .addValue("email", email)
                    .addValue("now", toTimestamp(now))
            );
        } catch (DuplicateKeyException e) {
            log.debug("User {} created concurrently", userId);
        }
        return findUser(userId);
    }

    @Override
    public TaskDefinition createTask(NewTask task) {
        String taskId = "task_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Instant now = Instant.now();
        jdbc.update(
            """
                INSERT INTO tasks (
                    id, name, user_id, keywords, filters, platforms, report_mode,
                    schedule, expand_keywords, status, description, created_at, updated_at
                )
                VALUES (
                    :id, :name, :userId, :keywords, :filters, :platforms, :reportMode,
                    :schedule, :expandKeywords, :status, :description, :now, :now
                )
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("name", task.name())
                .addValue("userId", task.userId())
                .addValue("keywords", toJson(task.keywords() == null ? List.of() : task.keywords()))
                .addValue("filters", toJson(task.filters() == null ? List.of() : task.filters()))
                .addValue("platforms", toJson(task.platforms() == null ? List.of() : task.platforms()))
                .addValue("reportMode", (task.reportMode() == null ? ReportMode.CURRENT : task.reportMode()).code())
                .addValue("schedule", task.schedule())
                .addValue("expandKeywords", task.expandKeywords() == null || task.expandKeywords())
                .addValue("status", TaskStatus.ACTIVE.code())
                .addValue("description", task.description())
                .addValue("now", toTimestamp(now))
        );
        return getTask(taskId).orElseThrow(() -> new IllegalStateException("Task insert not visible: " + taskId));
    }

    @Override
    public Optional<TaskDefinition> getTask(String taskId) {
        List<TaskDefinition> rows = jdbc.query(
            "SELECT * FROM tasks WHERE id = :id",
            new MapSqlParameterSource().addValue("id", taskId),
            taskRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<TaskDefinition> listTasks(String userId, TaskStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
        if (status == null) {
            return jdbc.query(
                """
                    SELECT *
                    FROM tasks
                    WHERE user_id = :userId
                    ORDER BY created_at DESC, id
                    """,
                params,
                taskRowMapper()
            );
        }
        params.addValue("status", status.code());
        return jdbc.query(
            """
                SELECT *
                FROM tasks
                WHERE user_id = :userId
                  AND status = :status
                ORDER BY created_at DESC, id
                """,
            params,
            taskRowMapper()
        );
    }

    @Override
    public boolean updateTask(String taskId, TaskUpdate update) {
        List<String> setClauses = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", taskId);
        if (update.name() != null) {
            setClauses.add("name = :name");
            params.addValue("name", update.name());
        }
        if (update.keywords() != null) {
            setClauses.add("keywords = :keywords");
            params.addValue("keywords", toJson(update.keywords()));
        }
        if (update.filters() != null) {
            setClauses.add("filters = :filters");
            params.addValue("filters", toJson(update.filters()));
        }
        if (update.platforms() != null) {
            setClauses.add("platforms = :platforms");
            params.addValue("platforms", toJson(update.platforms()));
        }
        if (update.reportMode() != null) {
            setClauses.add("report_mode = :reportMode");
            params.addValue("reportMode", update.reportMode().code());
        }
        if (update.schedule() != null) {
            setClauses.add("schedule = :schedule");
            params.addValue("schedule", update.schedule());
        }
        if (update.expandKeywords() != null) {
            setClauses.add("expand_keywords = :expandKeywords");
            params.addValue("expandKeywords", update.expandKeywords());
        }
        if (update.status() != null) {
            setClauses.add("status = :status");
            params.addValue("status", update.status().code());
        }
        if (update.description() != null) {
            setClauses.add("description = :description");
            params.addValue("description", update.description());
        }
        setClauses.add("updated_at = :updatedAt");
        params.addValue("updatedAt", toTimestamp(Instant.now()));

        int affected = jdbc.update(
            "UPDATE tasks SET " + String.join(", ", setClauses) + " WHERE id = :id",
            params
        );
        return affected > 0;
    }

    @Override
    public boolean deleteTask(String taskId) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", taskId);
        jdbc.update("DELETE FROM task_executions WHERE task_id = :id", params);
        return jdbc.update("DELETE FROM tasks WHERE id = :id", params) > 0;
    }

    @Override
    public long recordExecution(String taskId, ExecutionOutcome outcome) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO task_executions (
                    task_id, artifact_path, matched_count, duration_ms, status, error_message, executed_at
                )
                VALUES (
                    :taskId, :artifactPath, :matchedCount, :durationMs, :status, :errorMessage, :executedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("artifactPath", outcome.artifactPath())
                .addValue("matchedCount", outcome.matchedCount())
                .addValue("durationMs", outcome.durationMs())
                .addValue("status", outcome.status())
                .addValue("errorMessage", truncate(outcome.errorMessage(), 1000))
                .addValue("executedAt", toTimestamp(Instant.now())),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert task execution for " + taskId);
        }
        pruneExecutions(taskId);
        return key.longValue();
    }

    @Override
    public List<TaskExecution> listExecutions(String taskId, int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM task_executions
                WHERE task_id = :taskId
                ORDER BY executed_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("limit", Math.max(1, limit)),
            executionRowMapper()
        );
    }

    @Override
    public Optional<TaskExecution> latestExecution(String taskId) {
        List<TaskExecution> executions = listExecutions(taskId, 1);
        return executions.isEmpty() ? Optional.empty() : Optional.of(executions.get(0));
    }

    private void pruneExecutions(String taskId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("retain", properties.getTasks().getExecutionRetention());
        List<Long> stale = jdbc.queryForList(
            """
                SELECT id
                FROM task_executions
                WHERE task_id = :taskId
                ORDER BY executed_at DESC, id DESC
                OFFSET :retain ROWS
                """,
            params,
            Long.class
        );
        if (!stale.isEmpty()) {
            jdbc.update(
                "DELETE FROM task_executions WHERE id IN (:ids)",
                new MapSqlParameterSource().addValue("ids", stale)
            );
        }
    }

    private RadarUser findUser(String userId) {
        List<RadarUser> rows = jdbc.query(
            "SELECT * FROM users WHERE id = :id",
            new MapSqlParameterSource().addValue("id", userId),
            (rs, rowNum) -> new RadarUser(
                rs.getString("id"),
                rs.getString("username"),
                rs.getString("email"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private RowMapper<TaskDefinition> taskRowMapper() {
        return (rs, rowNum) -> new TaskDefinition(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("user_id"),
            fromJson(rs.getString("keywords"), KEYWORD_LIST),
            fromJson(rs.getString("filters"), STRING_LIST),
            fromJson(rs.getString("platforms"), STRING_LIST),
            ReportMode.fromCode(rs.getString("report_mode")),
            rs.getString("schedule"),
            rs.getBoolean("expand_keywords"),
            TaskStatus.fromCode(rs.getString("status")),
            rs.getString("description"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<TaskExecution> executionRowMapper() {
        return (rs, rowNum) -> new TaskExecution(
            rs.getLong("id"),
            rs.getString("task_id"),
            rs.getString("artifact_path"),
            rs.getInt("matched_count"),
            rs.getLong("duration_ms"),
            rs.getString("status"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("executed_at"))
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task field", e);
        }
    }

    private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> values = objectMapper.readValue(json, type);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable task field, treating as empty: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
