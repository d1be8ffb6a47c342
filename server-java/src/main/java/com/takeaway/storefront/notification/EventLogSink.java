package com.takeaway.storefront.notification;

import java.util.Map;

/**
 * Append-only document store for order lifecycle events.
 */
public interface EventLogSink {

    /** False when no store is configured; callers skip logging then. */
    boolean isEnabled();

    /**
     * @return the id the store assigned to the new document
     * @throws EventLogWriteException when the document could not be written
     */
    String append(String collection, Map<String, Object> document);
}
