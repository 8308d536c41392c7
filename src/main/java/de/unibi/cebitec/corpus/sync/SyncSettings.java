package de.unibi.cebitec.corpus.sync;

/**
 * Tunables of one run, resolved from command line options and the defaults in {@link CorpusSync}.
 */
public final class SyncSettings {

    private final int parallel;
    private final int maxAttempts;
    private final long retryDelayMillis;
    private final int requestTimeoutMillis;
    private final int pageSize;
    private final String region;
    private final String endpoint;

    public SyncSettings(int parallel, int maxAttempts, long retryDelayMillis, int requestTimeoutMillis, int pageSize,
                        String region, String endpoint) {
        if (parallel < 1) {
            throw new IllegalArgumentException("Parallel downloads must be at least 1 (got " + parallel + ")");
        }
        this.parallel = parallel;
        this.maxAttempts = maxAttempts;
        this.retryDelayMillis = retryDelayMillis;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.pageSize = pageSize;
        this.region = region;
        this.endpoint = endpoint;
    }

    public static SyncSettings defaults() {
        return new SyncSettings(CorpusSync.DEFAULT_PARALLEL, CorpusSync.MAX_ATTEMPTS, CorpusSync.RETRY_DELAY_MILLIS,
                CorpusSync.REQUEST_TIMEOUT_MILLIS, CorpusSync.PAGE_SIZE, CorpusSync.DEFAULT_REGION, null);
    }

    public SyncSettings withParallel(int newParallel) {
        return new SyncSettings(newParallel, this.maxAttempts, this.retryDelayMillis, this.requestTimeoutMillis,
                this.pageSize, this.region, this.endpoint);
    }

    public SyncSettings withS3Location(String newRegion, String newEndpoint) {
        return new SyncSettings(this.parallel, this.maxAttempts, this.retryDelayMillis, this.requestTimeoutMillis,
                this.pageSize, newRegion, newEndpoint);
    }

    public int getParallel() {
        return parallel;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryDelayMillis() {
        return retryDelayMillis;
    }

    public int getRequestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    public int getPageSize() {
        return pageSize;
    }

    public String getRegion() {
        return region;
    }

    /**
     * @return custom S3 endpoint, {@code null} for AWS
     */
    public String getEndpoint() {
        return endpoint;
    }
}
