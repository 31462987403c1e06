package com.macrointel.ingest.client;

/**
 * Enforces a minimum interval between consecutive calls to one provider.
 * Thread-safe; concurrent callers queue behind each other.
 */
public class RequestPacer {

    private final long minIntervalMs;
    private long lastRequestAt;

    public RequestPacer(long minIntervalMs) {
        this.minIntervalMs = Math.max(0, minIntervalMs);
    }

    public synchronized void await() {
        long elapsed = System.currentTimeMillis() - lastRequestAt;
        if (elapsed < minIntervalMs) {
            sleepMs(minIntervalMs - elapsed);
        }
        lastRequestAt = System.currentTimeMillis();
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
