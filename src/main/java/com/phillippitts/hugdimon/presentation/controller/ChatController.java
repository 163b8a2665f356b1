package com.phillippitts.hugdimon.presentation.controller;

import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.domain.TurnRequest;
import com.phillippitts.hugdimon.domain.TurnResponse;
import com.phillippitts.hugdimon.presentation.dto.ChatRequest;
import com.phillippitts.hugdimon.presentation.dto.ChatResponse;
import com.phillippitts.hugdimon.presentation.dto.DialogLogResponse;
import com.phillippitts.hugdimon.service.orchestration.ResponseCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Chat API. Thin adapter over {@link ResponseCoordinator}; errors are mapped by
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/chat")
class ChatController {

    private static final Logger LOG = LogManager.getLogger(ChatController.class);

    private final ResponseCoordinator coordinator;

    ChatController(ResponseCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        TurnResponse turn = coordinator.handleTurn(
                new TurnRequest(request.conversationId(), request.message(), request.detectedLanguage()));
        return ResponseEntity.ok(ChatResponse.from(turn));
    }

    /**
     * Voice turn: the raw request body is the recorded audio.
     */
    @PostMapping(value = "/voice", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ChatResponse> voice(@RequestParam(name = "conversation_id", required = false) String conversationId,
                                       @RequestBody byte[] audio) {
        LOG.debug("Voice turn received: {} bytes", audio.length);
        return ResponseEntity.ok(ChatResponse.from(coordinator.handleVoiceTurn(conversationId, audio)));
    }

    @GetMapping(value = "/{conversationId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<DialogLogResponse> history(@PathVariable String conversationId) {
        return ResponseEntity.ok(DialogLogResponse.of(conversationId, coordinator.dialogLog(conversationId)));
    }

    @DeleteMapping(value = "/{conversationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> reset(@PathVariable String conversationId) {
        SessionState state = coordinator.reset(conversationId);
        return ResponseEntity.ok(Map.of(
                "conversation_id", state.getConversationId(),
                "step", state.getCurrentStepId()
        ));
    }
}
