package de.unibi.cebitec.corpus.sync.util;

import java.net.URI;
import java.net.URISyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code s3://<bucket>/<prefix>} as given on the command line for custom sources.
 */
public class S3URI {
    private static final Logger log = LoggerFactory.getLogger(S3URI.class);
    private final String bucket;
    private final String key;

    public S3URI(String s3uri) throws URISyntaxException, IllegalArgumentException {
        URI uri = new URI(s3uri);
        if (!"s3".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Invalid S3URI '" + s3uri + "' - expected s3://<bucket>/<prefix>");
        }
        this.bucket = uri.getAuthority();
        if (this.bucket == null) {
            log.warn("URI: {}   BUCKET: null", s3uri);
            throw new IllegalArgumentException("Invalid S3URI - no bucket specified!");
        }
        String path = uri.getPath();
        this.key = path == null || path.isEmpty() ? "" : path.substring(1);
        log.debug("URI: {}   BUCKET: {}   KEY: {}", s3uri, this.bucket, this.key);
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    /**
     * Last path element of the prefix, used as local folder name; the bucket name for an empty prefix.
     */
    public String getFolderName() {
        String trimmed = this.key;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return this.bucket;
        }
        return trimmed.contains("/") ? trimmed.substring(trimmed.lastIndexOf('/') + 1) : trimmed;
    }
}
