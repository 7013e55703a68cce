package com.mouse.crawl.dispatch;

import com.mouse.crawl.enums.OperationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logical upstream call. The cursor is kept apart from the variables so it can be swapped per page.
 */
public record UpstreamRequest(OperationKind operation, Map<String, Object> variables, String cursor) {

    public UpstreamRequest {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static UpstreamRequest of(OperationKind operation, Map<String, Object> variables) {
        return new UpstreamRequest(operation, variables, null);
    }

    public UpstreamRequest withCursor(String nextCursor) {
        return new UpstreamRequest(operation, variables, nextCursor);
    }

    /** Variables as sent on the wire, cursor included when present. */
    public Map<String, Object> effectiveVariables() {
        Map<String, Object> merged = new LinkedHashMap<>(variables);
        if (cursor != null) {
            merged.put("cursor", cursor);
        }
        return merged;
    }

    /** Search text for passive capture; null for operations without one. */
    public String rawQuery() {
        Object query = variables.get("rawQuery");
        return query == null ? null : query.toString();
    }
}
