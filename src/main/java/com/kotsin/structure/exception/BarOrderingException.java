package com.kotsin.structure.exception;

/**
 * Duplicate or out-of-order bar. The bar is rejected, never re-ordered.
 */
public class BarOrderingException extends StructureDetectionException {

    private final long lastTimestamp;
    private final long rejectedTimestamp;

    public BarOrderingException(long lastTimestamp, long rejectedTimestamp) {
        super(ErrorCode.BAR_OUT_OF_ORDER, String.format(
                "Bar timestamp %d is not after last processed timestamp %d",
                rejectedTimestamp, lastTimestamp));
        this.lastTimestamp = lastTimestamp;
        this.rejectedTimestamp = rejectedTimestamp;
    }

    public long getLastTimestamp() {
        return lastTimestamp;
    }

    public long getRejectedTimestamp() {
        return rejectedTimestamp;
    }
}
