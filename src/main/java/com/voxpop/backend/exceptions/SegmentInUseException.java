package com.voxpop.backend.exceptions;

/**
 * Segment deletion blocked because an active campaign targets it.
 */
public class SegmentInUseException extends RuntimeException {

    private final Long segmentId;

    public SegmentInUseException(Long segmentId) {
        super("Segment " + segmentId + " is targeted by an active campaign and cannot be deleted");
        this.segmentId = segmentId;
    }

    public Long getSegmentId() {
        return segmentId;
    }
}
