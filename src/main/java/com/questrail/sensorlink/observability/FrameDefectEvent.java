package com.questrail.sensorlink.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a wire-level defect found while reading DataPoint
 * frames. Defects never reach callers as exceptions; they are reported here
 * and the affected bytes or record are dropped.
 *
 * @param dataPointId id of the affected record, or {@code -1} when the defect
 *                    precedes or spans record boundaries
 */
public record FrameDefectEvent(
    Instant timestamp,
    Kind kind,
    int dataPointId,
    String detail
) {
    public enum Kind {
        /** A header or payload ran past the end of the buffer. */
        TRUNCATED,
        /** A frame carried a type code outside the known set. */
        UNKNOWN_TYPE,
        /** A payload could not be interpreted under its type tag. */
        TYPE_MISMATCH,
        /** No wrapper encoding produced a usable byte sequence. */
        UNREADABLE_INPUT
    }

    public FrameDefectEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
