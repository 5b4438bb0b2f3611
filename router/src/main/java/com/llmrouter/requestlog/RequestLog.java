package com.llmrouter.requestlog;

import java.util.List;

/**
 * Recent per-call history, newest first. Entries older than {@code llm.request-log.retention}
 * or beyond {@code llm.request-log.max-entries} are dropped.
 */
public interface RequestLog {

    void record(RequestLogEntry entry);

    /**
     * @param providerId only entries for this provider, or all when null
     * @param type       only entries of this type, or all when null
     */
    List<RequestLogEntry> recent(Long providerId, RequestType type, int limit);

    /**
     * Removes entries past the retention window and returns how many were dropped.
     */
    int prune();

    /**
     * @param providerId provider whose entries go, or every entry when null
     */
    int clear(Long providerId);
}
