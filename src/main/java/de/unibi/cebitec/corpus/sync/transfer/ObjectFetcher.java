package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Transfers the bytes of one remote unit into a local file.
 */
public interface ObjectFetcher {

    /**
     * Writes the complete body of the unit behind {@code task} to {@code target}, replacing whatever is there.
     *
     * @return number of bytes written
     * @throws IOException if the transfer failed or ended early; the caller discards {@code target}
     */
    long fetch(FetchTask task, Path target) throws IOException;
}
