package de.unibi.cebitec.corpus.sync.transfer;

import java.util.concurrent.TimeUnit;

/**
 * Fixed number of attempts with a fixed pause in between.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long delayMillis;

    public RetryPolicy(int maxAttempts, long delayMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required: " + maxAttempts);
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException("Negative retry delay: " + delayMillis);
        }
        this.maxAttempts = maxAttempts;
        this.delayMillis = delayMillis;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    public void pause() throws InterruptedException {
        if (this.delayMillis > 0) {
            TimeUnit.MILLISECONDS.sleep(this.delayMillis);
        }
    }
}
