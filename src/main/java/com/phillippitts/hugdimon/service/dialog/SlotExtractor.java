package com.phillippitts.hugdimon.service.dialog;

import java.util.List;

/**
 * Finds slot values and intents in free text.
 */
public interface SlotExtractor {

    /**
     * @param input          user text, already sanitized
     * @param requestedSlots slots the current step is collecting
     * @param language       language code of {@code input}
     * @return candidates; never null
     */
    SlotExtraction extract(String input, List<String> requestedSlots, String language);
}
