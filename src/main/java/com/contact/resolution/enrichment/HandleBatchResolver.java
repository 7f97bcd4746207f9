package com.contact.resolution.enrichment;

import com.contact.resolution.core.model.ContactSummary;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a batch of raw handles to contacts, keyed by the raw handle.
 */
@FunctionalInterface
public interface HandleBatchResolver {

    CompletableFuture<Map<String, ContactSummary>> resolveBatch(List<String> rawHandles);
}
