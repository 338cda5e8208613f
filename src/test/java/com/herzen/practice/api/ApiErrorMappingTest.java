package com.herzen.practice.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ApiErrorMappingTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void pausingAnIdleSessionIsAConflict() throws Exception {
        mockMvc.perform(post("/api/sessions/multiple-choice/reset")).andExpect(status().isOk());

        mockMvc.perform(post("/api/sessions/multiple-choice/pause"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("STATE_ERROR"))
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void unknownContentTypeIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/sessions/flashcards"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void negativeDailyGoalIsRejected() throws Exception {
        mockMvc.perform(put("/api/manager/goal").contentType(MediaType.APPLICATION_JSON).content("{\"sessions\": -2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Daily goal must not be negative, got -2"));
    }

    @Test
    void registeredItemsAreListedWithLabels() throws Exception {
        String drafts = """
                [{"id": "api-1", "content": "What is a WAL?", "difficulty": "hard", "week": "week-4",
                  "topic": "storage", "keywords": ["log", "durability"]}]
                """;
        mockMvc.perform(post("/api/pool/api-course/open-questions").contentType(MediaType.APPLICATION_JSON).content(drafts))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registered").value(1))
                .andExpect(jsonPath("$.contentType").value("open-questions"));

        mockMvc.perform(get("/api/pool/api-course/open-questions").param("difficulty", "hard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("api-1"))
                .andExpect(jsonPath("$[0].difficulty").value("hard"));
    }
}
