package com.ai.autoreply.controller;

import com.ai.autoreply.dto.WidgetChatResponse;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.service.WidgetChatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WidgetControllerTest {

    private WidgetChatService widgetChatService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        widgetChatService = mock(WidgetChatService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new WidgetController(widgetChatService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void answersChat() throws Exception {
        Agent agent = Agent.builder().id(3L).name("Store").widgetEnabled(true).build();
        when(widgetChatService.findWidgetAgent(3L)).thenReturn(Optional.of(agent));
        when(widgetChatService.chat(agent, "When do you open?", "s-1"))
                .thenReturn(new WidgetChatResponse("We open at 9.", "s-1", true));

        mockMvc.perform(post("/api/widget/chat/3").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"When do you open?\",\"sessionId\":\"s-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("We open at 9."))
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.faq").value(true));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/widget/chat/3").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message is required"));

        verify(widgetChatService, never()).chat(any(), any(), any());
    }

    @Test
    void unknownOrDisabledAgentIs404() throws Exception {
        when(widgetChatService.findWidgetAgent(9L)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/widget/chat/9").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\"}"))
                .andExpect(status().isNotFound());
    }
}
