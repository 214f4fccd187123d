package com.cuttlefish.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "agent.prediction.upkeep-enabled=false",
        "agent.security.jwt-secret=01234567890123456789012345678901",
        "agent.security.api-keys.ai-agent={noop}agent-key"
})
@AutoConfigureMockMvc
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void validApiKeyYieldsUsableToken() throws Exception {
        String body = mockMvc.perform(post("/api/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\": \"ai-agent\", \"apiKey\": \"agent-key\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actorId").value("ai-agent"))
                .andExpect(jsonPath("$.expiresAt").exists())
                .andReturn().getResponse().getContentAsString();
        JsonNode issued = objectMapper.readTree(body);

        mockMvc.perform(get("/api/agent/trades/stats")
                        .header("Authorization", "Bearer " + issued.get("token").asText()))
                .andExpect(status().isOk());
    }

    @Test
    void wrongApiKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\": \"ai-agent\", \"apiKey\": \"guess\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    void actorWithoutApiKeyCannotObtainToken() throws Exception {
        mockMvc.perform(post("/api/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\": \"deployer\", \"apiKey\": \"agent-key\"}"))
                .andExpect(status().isUnauthorized());
    }
}
