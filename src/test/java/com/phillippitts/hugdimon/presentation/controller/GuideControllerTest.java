package com.phillippitts.hugdimon.presentation.controller;

import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.InvalidTurnException;
import com.phillippitts.hugdimon.service.retrieval.GuideAnswer;
import com.phillippitts.hugdimon.service.retrieval.GuideService;
import com.phillippitts.hugdimon.service.retrieval.RetrievalFeedbackRecorder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GuideController.class)
class GuideControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private GuideService guideService;

    @MockBean
    private RetrievalFeedbackRecorder feedbackRecorder;

    @MockBean
    private Clock clock;

    @Test
    void guideReturnsPlacesWithQueryId() throws Exception {
        when(guideService.answer("terrace?")).thenReturn(new GuideAnswer("q-1", "Casa Nun: Fresh fish.",
                GuideAnswer.Source.PLACES, List.of("restaurants/casa-nun")));

        mvc.perform(post("/guide").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"terrace?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query_id").value("q-1"))
                .andExpect(jsonPath("$.response").value("Casa Nun: Fresh fish."))
                .andExpect(jsonPath("$.source").value("places"))
                .andExpect(jsonPath("$.result_ids[0]").value("restaurants/casa-nun"));
    }

    @Test
    void blankQueryMapsTo400() throws Exception {
        when(guideService.answer(any())).thenThrow(new InvalidTurnException("message", "must not be blank"));

        mvc.perform(post("/guide").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\" \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void completionFailureMapsTo503() throws Exception {
        when(guideService.answer(any())).thenThrow(
                new ExternalServiceException(ExternalServiceException.Kind.UNAVAILABLE, "completion", "down"));

        mvc.perform(post("/guide").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"sunset\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("ExternalServiceException"));
    }

    @Test
    void feedbackIsRecorded() throws Exception {
        when(clock.instant()).thenReturn(Instant.parse("2025-06-01T19:00:00Z"));

        mvc.perform(post("/feedback/rag").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query_id\":\"q-1\",\"is_helpful\":true,\"result_ids\":[\"restaurants/casa-nun\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("Feedback recorded successfully"))
                .andExpect(jsonPath("$.timestamp").value("2025-06-01T19:00:00Z"));

        verify(feedbackRecorder).record("q-1", true, List.of("restaurants/casa-nun"));
    }

    @Test
    void feedbackWithoutQueryIdIsRejected() throws Exception {
        mvc.perform(post("/feedback/rag").contentType(MediaType.APPLICATION_JSON).content("{\"is_helpful\":false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidTurnException"));

        verify(feedbackRecorder, never()).record(anyString(), anyBoolean(), any());
    }

    @Test
    void feedbackWithoutVerdictIsRejected() throws Exception {
        mvc.perform(post("/feedback/rag").contentType(MediaType.APPLICATION_JSON).content("{\"query_id\":\"q-1\"}"))
                .andExpect(status().isBadRequest());
    }
}
