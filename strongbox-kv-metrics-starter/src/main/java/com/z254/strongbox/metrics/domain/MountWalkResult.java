package com.z254.strongbox.metrics.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of walking one mount's key space.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MountWalkResult {

    public enum Status {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    KvMount mount;
    Status status;

    /** Leaf secrets counted; only meaningful for {@link Status#SUCCESS} */
    long secretCount;

    /** Cause of a {@link Status#FAILED} walk, otherwise null */
    Throwable failure;

    public static MountWalkResult success(KvMount mount, long secretCount) {
        return new MountWalkResult(mount, Status.SUCCESS, secretCount, null);
    }

    public static MountWalkResult failure(KvMount mount, Throwable cause) {
        return new MountWalkResult(mount, Status.FAILED, 0, cause);
    }

    public static MountWalkResult cancelled(KvMount mount) {
        return new MountWalkResult(mount, Status.CANCELLED, 0, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
