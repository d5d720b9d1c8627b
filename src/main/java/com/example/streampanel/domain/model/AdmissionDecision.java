package com.example.streampanel.domain.model;

import com.example.streampanel.common.exception.ErrorCode;

/**
 * Outcome of one admission attempt against a concurrency cap.
 */
public final class AdmissionDecision {

    private static final AdmissionDecision ADMITTED = new AdmissionDecision(true, null, -1, -1);

    private final boolean admitted;
    private final ErrorCode reason;
    private final long activeCount;
    private final long limit;

    private AdmissionDecision(boolean admitted, ErrorCode reason, long activeCount, long limit) {
        this.admitted = admitted;
        this.reason = reason;
        this.activeCount = activeCount;
        this.limit = limit;
    }

    public static AdmissionDecision admitted() {
        return ADMITTED;
    }

    public static AdmissionDecision rejected(ErrorCode reason, long activeCount, long limit) {
        return new AdmissionDecision(false, reason, activeCount, limit);
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public ErrorCode getReason() {
        return reason;
    }

    public long getActiveCount() {
        return activeCount;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        if (admitted) {
            return "Admitted";
        }
        return "Rejected(" + reason + ", active=" + activeCount + ", limit=" + limit + ")";
    }
}
