package de.unibi.cebitec.corpus.sync.transfer;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.util.FileTrees;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts a zip bundle into a staging directory next to the local path and renames the staging directory
 * once every entry is written. An interrupted extraction therefore never leaves a half filled directory at the
 * local path.
 */
public class ZipArchiveMaterializer implements Materializer {

    public static final Logger log = LoggerFactory.getLogger(ZipArchiveMaterializer.class);

    @Override
    public long materialize(FetchTask task, Path downloaded) throws IOException {
        Path staging = task.getStagingPath();
        FileTrees.deleteRecursively(staging);
        Files.createDirectories(staging);

        long files = extract(downloaded, staging);
        if (files == 0) {
            throw new ExtractionFailedException("Archive '" + task.getKey() + "' contains no files");
        }

        Path target = task.getLocalPath();
        if (Files.isDirectory(target) && FileTrees.isEmptyDirectory(target)) {
            // left over by an older tool or an aborted manual copy, not a finished unit
            Files.delete(target);
        }
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, target);
        }
        Files.deleteIfExists(downloaded);
        log.debug("Extracted {} files of '{}' to {}", files, task.getKey(), target);
        return files;
    }

    private long extract(Path archive, Path staging) throws ExtractionFailedException {
        long files = 0;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path out = staging.resolve(entry.getName()).normalize();
                if (out.equals(staging)) {
                    continue;
                }
                if (!out.startsWith(staging)) {
                    throw new ExtractionFailedException("Archive entry '" + entry.getName() + "' points outside of the extraction directory");
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                    continue;
                }
                Files.createDirectories(out.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                }
                files++;
            }
        } catch (ZipException e) {
            throw new ExtractionFailedException("Corrupt archive " + archive.getFileName() + ": " + e.getMessage(), e);
        } catch (ExtractionFailedException e) {
            throw e;
        } catch (IOException e) {
            throw new ExtractionFailedException("Extraction of " + archive.getFileName() + " failed: " + e.getMessage(), e);
        }
        return files;
    }

    @Override
    public void discard(FetchTask task) throws IOException {
        Files.deleteIfExists(task.getTempPath());
        FileTrees.deleteRecursively(task.getStagingPath());
    }
}
