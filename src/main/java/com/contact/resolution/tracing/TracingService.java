package com.contact.resolution.tracing;

import java.util.Map;

/**
 * Starts spans around calls to the identity source. Only the two slow paths
 * are traced: the bulk {@value #INDEX_BUILD} and the targeted
 * {@value #NAME_SEARCH}. Index lookups are in-memory and carry no span.
 */
public interface TracingService {

    String INDEX_BUILD = "contact.index.build";
    String NAME_SEARCH = "contact.search";

    String ATTR_SOURCE = "source";
    String ATTR_KEYS = "keys";
    String ATTR_OUTCOME = "outcome";
    String ATTR_MATCHES = "matches";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
