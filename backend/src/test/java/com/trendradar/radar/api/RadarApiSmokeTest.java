package com.trendradar.radar.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class RadarApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void searchRequiresGenerateReport() throws Exception {
        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\":[\"AI\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void searchRejectsEmptyKeywords() throws Exception {
        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\":[],\"generateReport\":false}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void searchRejectsUnknownReportMode() throws Exception {
        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\":[\"AI\"],\"reportMode\":\"weekly\",\"generateReport\":false}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void listTasksRequiresUserId() throws Exception {
        mockMvc.perform(get("/api/tasks"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void unknownTaskIsNotFound() throws Exception {
        mockMvc.perform(get("/api/tasks/task_missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("task_not_found"));
        mockMvc.perform(post("/api/tasks/task_missing/execute"))
            .andExpect(status().isNotFound());
    }

    @Test
    void taskLifecycleThroughTheApi() throws Exception {
        String userId = "u-" + UUID.randomUUID();
        String created = mockMvc.perform(post("/api/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId":"%s","name":"AI watch","keywords":["AI",{"label":"芯片","terms":["芯片","半导体"]}],
                     "filters":["广告"],"platforms":["weibo"],"reportMode":"daily","expandKeywords":false}
                    """.formatted(userId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.task.keywords", hasSize(2)))
            .andExpect(jsonPath("$.task.reportMode").value("daily"))
            .andReturn().getResponse().getContentAsString();
        JsonNode body = objectMapper.readTree(created);
        String taskId = body.path("task").path("id").asText();

        mockMvc.perform(get("/api/tasks").param("userId", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.tasks[0].id").value(taskId));

        mockMvc.perform(put("/api/tasks/" + taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"paused\",\"reportMode\":\"incremental\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.task.status").value("paused"))
            .andExpect(jsonPath("$.task.reportMode").value("incremental"));

        mockMvc.perform(post("/api/tasks/" + taskId + "/execute"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.taskId").value(taskId))
            .andExpect(jsonPath("$.stats.platformsQueried").value(1))
            .andExpect(jsonPath("$.artifactPath").isNotEmpty());

        mockMvc.perform(get("/api/tasks/" + taskId + "/executions").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.executions", hasSize(1)))
            .andExpect(jsonPath("$.executions[0].status").value("success"));

        mockMvc.perform(get("/api/tasks/" + taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recentExecutions", hasSize(1)));

        mockMvc.perform(delete("/api/tasks/" + taskId))
            .andExpect(status().isOk());
        mockMvc.perform(delete("/api/tasks/" + taskId))
            .andExpect(status().isNotFound());
    }

    @Test
    void createTaskRequiresNameAndKeywords() throws Exception {
        mockMvc.perform(post("/api/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"u-1\",\"keywords\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void configCanBeReplacedAndReadBack() throws Exception {
        mockMvc.perform(put("/api/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywordGroups\":[\"AI\"],\"filters\":[\"广告\"],\"platforms\":[\"weibo\"],\"reportMode\":\"daily\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reportMode").value("daily"));

        mockMvc.perform(get("/api/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.keywordGroups[0].label").value("AI"))
            .andExpect(jsonPath("$.filters[0]").value("广告"))
            .andExpect(jsonPath("$.platforms[0]").value("weibo"));
    }
}
