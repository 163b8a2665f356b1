package com.phillippitts.hugdimon.service.prompt;

import java.util.List;

/**
 * Final prompt text plus a record of what the token budget let in.
 *
 * @param text                 prompt sent to the completion model
 * @param tokenCount           tokens in {@code text}
 * @param includedChunkIds     ids of the context chunks kept, in rank order
 * @param includedHistoryTurns number of history turns kept
 * @param droppedChunks        context chunks removed to fit the budget
 * @param droppedHistoryTurns  history turns removed to fit the budget
 */
public record AssembledPrompt(String text,
                              int tokenCount,
                              List<String> includedChunkIds,
                              int includedHistoryTurns,
                              int droppedChunks,
                              int droppedHistoryTurns) {

    public AssembledPrompt {
        includedChunkIds = List.copyOf(includedChunkIds);
    }
}
