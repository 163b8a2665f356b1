package com.phillippitts.hugdimon.service.transcription;

import com.phillippitts.hugdimon.exception.ExternalServiceException;

/** Speech-to-text collaborator used for voice turns. */
public interface TranscriptionClient {

    /**
     * @param audio encoded audio as uploaded by the client
     * @throws ExternalServiceException if the service fails
     */
    Transcript transcribe(byte[] audio);
}
