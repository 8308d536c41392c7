package de.unibi.cebitec.corpus.sync.transfer;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectInputStream;
import de.unibi.cebitec.corpus.sync.model.FetchTask;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class S3ObjectFetcher implements ObjectFetcher {

    public static final Logger log = LoggerFactory.getLogger(S3ObjectFetcher.class);
    private final AmazonS3 s3;
    private final String bucketName;

    public S3ObjectFetcher(AmazonS3 s3, String bucketName) {
        this.s3 = s3;
        this.bucketName = bucketName;
    }

    @Override
    public long fetch(FetchTask task, Path target) throws IOException {
        GetObjectRequest getObjReq = new GetObjectRequest(this.bucketName, task.getKey());
        log.debug("Starting download of s3://{}/{}", this.bucketName, task.getKey());
        try (S3Object obj = this.s3.getObject(getObjReq)) {
            if (obj == null) {
                throw new IOException("No content returned for s3://" + this.bucketName + "/" + task.getKey());
            }
            S3ObjectInputStream in = obj.getObjectContent();
            long expected = task.getDescriptor().getSizeBytes();
            long bytesRead;
            try {
                bytesRead = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                // drop the connection instead of draining the rest of the body
                in.abort();
                throw e;
            }
            if (expected > 0 && bytesRead != expected) {
                throw new IOException("Transfer of '" + task.getKey() + "' has been interrupted! "
                        + bytesRead + " of " + expected + " bytes received.");
            }
            log.debug("Download done: {} ({} bytes)", task.getKey(), bytesRead);
            return bytesRead;
        }
    }
}
