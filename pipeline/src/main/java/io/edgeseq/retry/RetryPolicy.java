package io.edgeseq.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    /** Fails on the first error. */
    static RetryPolicy none() {
        return new ExponentialBackoffRetryPolicy(1, 1, 1);
    }
}
