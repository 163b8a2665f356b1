package com.phillippitts.hugdimon.service.prompt;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * {@link TokenCounter} backed by JTokkit's {@code cl100k_base} encoding, the tokenizer of the
 * GPT-3.5/GPT-4 model family.
 */
public class JtokkitTokenCounter implements TokenCounter {

    private final Encoding encoding;

    public JtokkitTokenCounter() {
        this(EncodingType.CL100K_BASE);
    }

    public JtokkitTokenCounter(EncodingType type) {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(type);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
