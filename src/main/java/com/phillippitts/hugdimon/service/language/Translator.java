package com.phillippitts.hugdimon.service.language;

import com.phillippitts.hugdimon.exception.ExternalServiceException;

/** Machine translation collaborator. */
public interface Translator {

    /**
     * @param source language code of {@code text}, or null to let the service detect it
     * @param target language code to translate into
     * @throws ExternalServiceException if the service fails
     */
    String translate(String text, String source, String target);
}
