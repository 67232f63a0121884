package com.edge.match.controller;

import com.edge.match.dto.DeduplicationRequest;
import com.edge.match.dto.DeduplicationResult;
import com.edge.match.service.EventConsolidationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventController.class)
class EventControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private EventConsolidationService consolidationService;

    @Test
    void deduplicate_parses_event_codes() throws Exception {
        DeduplicationResult result = new DeduplicationResult();
        result.setValid(true);
        Mockito.when(consolidationService.consolidate(any(DeduplicationRequest.class))).thenReturn(result);

        String body = "{\"events\":[{\"windowId\":\"w1\",\"relativeTimestamp\":3.5,\"type\":\"setPiece\","
                + "\"team\":\"away\",\"zone\":\"attacking_third\",\"confidence\":0.7}],"
                + "\"windows\":[{\"windowId\":\"w1\",\"absoluteStart\":30,\"absoluteEnd\":60}],\"fps\":25}";

        mockMvc.perform(post("/api/events/deduplicate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("success")))
                .andExpect(jsonPath("$.data.valid", is(true)));

        ArgumentCaptor<DeduplicationRequest> captor = ArgumentCaptor.forClass(DeduplicationRequest.class);
        Mockito.verify(consolidationService).consolidate(captor.capture());
        DeduplicationRequest parsed = captor.getValue();
        assertThat(parsed.getFps()).isEqualTo(25.0);
        assertThat(parsed.getEvents()).hasSize(1);
        assertThat(parsed.getEvents().get(0).getType().getCode()).isEqualTo("setPiece");
        assertThat(parsed.getEvents().get(0).getTeam().name()).isEqualTo("AWAY");
        assertThat(parsed.getWindows().get(0).getAbsoluteStart()).isEqualTo(30.0);
    }

    @Test
    void malformed_events_return_bad_request() throws Exception {
        Mockito.when(consolidationService.consolidate(any(DeduplicationRequest.class)))
                .thenThrow(new IllegalArgumentException("Raw event at index 0 has no windowId"));

        mockMvc.perform(post("/api/events/deduplicate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[{\"type\":\"pass\",\"team\":\"HOME\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("Raw event at index 0 has no windowId")));
    }
}
