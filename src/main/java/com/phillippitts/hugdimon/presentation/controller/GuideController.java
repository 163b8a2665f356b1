package com.phillippitts.hugdimon.presentation.controller;

import com.phillippitts.hugdimon.exception.InvalidTurnException;
import com.phillippitts.hugdimon.presentation.dto.GuideRequest;
import com.phillippitts.hugdimon.presentation.dto.GuideResponse;
import com.phillippitts.hugdimon.presentation.dto.RagFeedbackRequest;
import com.phillippitts.hugdimon.presentation.dto.RagFeedbackResponse;
import com.phillippitts.hugdimon.service.retrieval.GuideService;
import com.phillippitts.hugdimon.service.retrieval.RetrievalFeedbackRecorder;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Stateless place guide and feedback on its answers.
 */
@RestController
class GuideController {

    private final GuideService guideService;
    private final RetrievalFeedbackRecorder feedbackRecorder;
    private final Clock clock;

    GuideController(GuideService guideService, RetrievalFeedbackRecorder feedbackRecorder, Clock clock) {
        this.guideService = guideService;
        this.feedbackRecorder = feedbackRecorder;
        this.clock = clock;
    }

    @PostMapping(value = "/guide", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<GuideResponse> guide(@RequestBody GuideRequest request) {
        return ResponseEntity.ok(GuideResponse.from(guideService.answer(request.query())));
    }

    @PostMapping(value = "/feedback/rag", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<RagFeedbackResponse> feedback(@RequestBody RagFeedbackRequest request) {
        if (request.queryId() == null || request.queryId().isBlank()) {
            throw new InvalidTurnException("query_id", "must not be blank");
        }
        if (request.helpful() == null) {
            throw new InvalidTurnException("is_helpful", "must be true or false");
        }
        feedbackRecorder.record(request.queryId(), request.helpful(), request.resultIds());
        return ResponseEntity.ok(RagFeedbackResponse.recorded(clock.instant()));
    }
}
