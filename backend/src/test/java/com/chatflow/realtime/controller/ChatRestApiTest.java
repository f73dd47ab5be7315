package com.chatflow.realtime.controller;

import com.chatflow.realtime.security.JwtUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ChatRestApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtUtil jwtUtil;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(get("/api/chats"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/chats").header("Authorization", "Bearer garbage"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void sendAndBackfillRoundTrip() throws Exception {
        String chatId = createGroup("rest-alice", "rest-bob");

        for (int i = 1; i <= 3; i++) {
            mockMvc.perform(post("/api/messages")
                            .header("Authorization", bearer("rest-alice"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"chatId\":\"" + chatId + "\",\"content\":\"msg " + i + "\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.sequence").value(i))
                    .andExpect(jsonPath("$.status").value("sent"));
        }

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .param("limit", "2")
                        .header("Authorization", bearer("rest-bob")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages", hasSize(2)))
                .andExpect(jsonPath("$.messages[0].content").value("msg 2"))
                .andExpect(jsonPath("$.has_more").value(true))
                .andExpect(jsonPath("$.next_cursor").isNotEmpty());

        mockMvc.perform(get("/api/chats").header("Authorization", bearer("rest-bob")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(chatId))
                .andExpect(jsonPath("$[0].unreadCount").value(3));

        mockMvc.perform(post("/api/chats/{chatId}/read", chatId).header("Authorization", bearer("rest-bob")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").value(3));

        mockMvc.perform(get("/api/chats").header("Authorization", bearer("rest-bob")))
                .andExpect(jsonPath("$[0].unreadCount").value(0));
    }

    @Test
    void errorsUseTheCommonErrorBody() throws Exception {
        String chatId = createGroup("err-alice", "err-bob");

        mockMvc.perform(post("/api/messages")
                        .header("Authorization", bearer("err-alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":\"" + chatId + "\",\"content\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.status").value(400));

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId).header("Authorization", bearer("err-mallory")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("CHAT_ACCESS_DENIED"));

        mockMvc.perform(get("/api/chats/{chatId}/messages", "missing").header("Authorization", bearer("err-alice")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId)
                        .param("before", "no-such-message")
                        .header("Authorization", bearer("err-alice")))
                .andExpect(status().isNotFound());
    }

    @Test
    void editAndDeleteThroughRest() throws Exception {
        String chatId = createGroup("ed-alice", "ed-bob");
        String body = mockMvc.perform(post("/api/messages")
                        .header("Authorization", bearer("ed-alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":\"" + chatId + "\",\"content\":\"draft\"}"))
                .andReturn().getResponse().getContentAsString();
        String messageId = objectMapper.readTree(body).get("id").asText();

        mockMvc.perform(put("/api/messages/{id}", messageId)
                        .header("Authorization", bearer("ed-bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"mine now\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/messages/{id}", messageId)
                        .header("Authorization", bearer("ed-alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"final\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.edited").value(true));

        mockMvc.perform(delete("/api/messages/{id}", messageId).header("Authorization", bearer("ed-alice")))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/chats/{chatId}/messages", chatId).header("Authorization", bearer("ed-bob")))
                .andExpect(jsonPath("$.messages", hasSize(0)))
                .andExpect(jsonPath("$.has_more").value(false));
    }

    private String createGroup(String owner, String member) throws Exception {
        String body = mockMvc.perform(post("/api/chats")
                        .header("Authorization", bearer(owner))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"group\",\"name\":\"team\",\"memberIds\":[\"" + member + "\"]}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode chat = objectMapper.readTree(body);
        return chat.get("id").asText();
    }

    private String bearer(String userId) {
        return "Bearer " + jwtUtil.generateAccessToken(userId, userId);
    }
}
