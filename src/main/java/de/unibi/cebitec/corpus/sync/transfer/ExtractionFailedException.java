package de.unibi.cebitec.corpus.sync.transfer;

import java.io.IOException;

/**
 * A downloaded archive could not be unpacked. Handled like any other failed transfer attempt.
 */
public class ExtractionFailedException extends IOException {

    public ExtractionFailedException(String message) {
        super(message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
