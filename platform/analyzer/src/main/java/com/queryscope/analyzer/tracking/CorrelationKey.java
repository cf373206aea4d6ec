package com.queryscope.analyzer.tracking;

import java.util.Objects;

/**
 * Identifies one in-flight command: the host's connection id plus its command id.
 *
 * Both parts are opaque to queryscope and only need to be unique among the
 * commands that are active at the same time.
 */
public record CorrelationKey(Object connectionId, Object commandId) {

    public CorrelationKey {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(commandId, "commandId");
    }

    @Override
    public String toString() {
        return connectionId + "/" + commandId;
    }
}
