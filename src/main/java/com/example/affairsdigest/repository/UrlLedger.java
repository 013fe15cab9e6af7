/**
 * UrlLedger is the deduplication store of article URLs that were already processed.
 * - exists(url): whether the URL was recorded by an earlier run.
 * - insert(url, timestamp): records the URL together with the time it was processed.
 * - checkAndInsert(url, timestamp): both steps as one atomic operation; returns true when the URL is new.
 * Implementations that lose their backing store treat every URL as new instead of failing the run.
 */

package com.example.affairsdigest.repository;

import java.time.LocalDateTime;

public interface UrlLedger {
    boolean exists(String url);
    void insert(String url, LocalDateTime processedAt);
    boolean checkAndInsert(String url, LocalDateTime processedAt);
}
