package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renames the temp file onto the local path.
 */
public class FileMaterializer implements Materializer {

    public static final Logger log = LoggerFactory.getLogger(FileMaterializer.class);

    @Override
    public long materialize(FetchTask task, Path downloaded) throws IOException {
        try {
            Files.move(downloaded, task.getLocalPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain move.", task.getLocalPath());
            Files.move(downloaded, task.getLocalPath(), StandardCopyOption.REPLACE_EXISTING);
        }
        return 1;
    }

    @Override
    public void discard(FetchTask task) throws IOException {
        Files.deleteIfExists(task.getTempPath());
    }
}
