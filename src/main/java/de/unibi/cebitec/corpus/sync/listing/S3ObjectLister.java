package de.unibi.cebitec.corpus.sync.listing;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsRequest;
import com.amazonaws.services.s3.model.ObjectListing;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marker based paging over a bucket listing. Pseudo-folder entries (keys ending with '/') are dropped, and with a
 * key suffix only matching keys are listed and counted.
 */
public class S3ObjectLister implements ObjectLister {

    public static final Logger log = LoggerFactory.getLogger(S3ObjectLister.class);
    public static final int DEFAULT_PAGE_SIZE = 1000;
    private final AmazonS3 s3;
    private final int pageSize;
    private final String keySuffix;

    public S3ObjectLister(AmazonS3 s3) {
        this(s3, DEFAULT_PAGE_SIZE);
    }

    public S3ObjectLister(AmazonS3 s3, int pageSize) {
        this(s3, pageSize, null);
    }

    /**
     * @param keySuffix only keys ending with it are listed, {@code null} or empty for all keys
     */
    public S3ObjectLister(AmazonS3 s3, int pageSize, String keySuffix) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.s3 = s3;
        this.pageSize = pageSize;
        this.keySuffix = keySuffix == null || keySuffix.isEmpty() ? null : keySuffix;
    }

    /**
     * S3 lists keys in ascending order of their UTF-8 bytes.
     */
    static boolean isAfter(String key, String previous) {
        return previous == null
                || Arrays.compareUnsigned(key.getBytes(StandardCharsets.UTF_8), previous.getBytes(StandardCharsets.UTF_8)) > 0;
    }

    @Override
    public ListingCursor open(String bucketName, String prefix, long maxItems) {
        log.debug("Listing s3://{}/{} (max items: {})", bucketName, prefix, maxItems < 0 ? "unbounded" : maxItems);
        return new S3ListingCursor(bucketName, prefix, maxItems);
    }

    private class S3ListingCursor extends ListingCursor {

        private final String bucketName;
        private final String prefix;
        private String marker;
        private String lastListedKey;
        private int pageCount;

        S3ListingCursor(String bucketName, String prefix, long maxItems) {
            super(maxItems);
            this.bucketName = bucketName;
            this.prefix = prefix;
        }

        @Override
        protected boolean fetchNextPage(Deque<ObjectDescriptor> page) throws ListingFailedException {
            ListObjectsRequest request = new ListObjectsRequest()
                    .withBucketName(this.bucketName)
                    .withPrefix(this.prefix)
                    .withMaxKeys(S3ObjectLister.this.pageSize);
            if (this.marker != null) {
                request.setMarker(this.marker);
            }

            ObjectListing listing;
            try {
                listing = S3ObjectLister.this.s3.listObjects(request);
            } catch (AmazonClientException e) {
                throw new ListingFailedException("Listing of s3://" + this.bucketName + "/" + this.prefix
                        + " failed on page " + (this.pageCount + 1) + ": " + e.getMessage(), e);
            }
            if (listing == null || listing.getObjectSummaries() == null) {
                throw new ListingFailedException("Malformed listing response for s3://" + this.bucketName + "/" + this.prefix
                        + " on page " + (this.pageCount + 1));
            }
            this.pageCount++;

            String lastKey = null;
            for (S3ObjectSummary summary : listing.getObjectSummaries()) {
                String key = summary.getKey();
                if (key == null) {
                    continue;
                }
                lastKey = key;
                if (key.endsWith("/")) {
                    log.trace("Skipping directory marker: {}", key);
                    continue;
                }
                if (!isAfter(key, this.lastListedKey)) {
                    log.debug("Dropping repeated key from page {}: {}", this.pageCount, key);
                    continue;
                }
                this.lastListedKey = key;
                if (S3ObjectLister.this.keySuffix != null && !key.endsWith(S3ObjectLister.this.keySuffix)) {
                    continue;
                }
                page.add(new ObjectDescriptor(key, Math.max(0, summary.getSize())));
            }
            log.trace("Page {} of s3://{}/{}: {} keys, truncated: {}", this.pageCount, this.bucketName, this.prefix,
                    listing.getObjectSummaries().size(), listing.isTruncated());

            if (!listing.isTruncated()) {
                return false;
            }
            // S3 only returns a next marker for delimited listings, the last key continues the others
            String nextMarker = listing.getNextMarker() != null ? listing.getNextMarker() : lastKey;
            if (nextMarker == null || nextMarker.equals(this.marker)) {
                log.warn("Listing of s3://{}/{} reports more pages but makes no progress after '{}'. Stopping.",
                        this.bucketName, this.prefix, this.marker);
                return false;
            }
            this.marker = nextMarker;
            return true;
        }
    }
}
