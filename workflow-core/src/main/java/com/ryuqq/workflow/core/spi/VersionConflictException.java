package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.model.RequestId;

/**
 * Thrown by {@link RequestStore#save} when the stored version does not match the expected one.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class VersionConflictException extends RuntimeException {

    private final transient RequestId requestId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(RequestId requestId, long expectedVersion, long actualVersion) {
        super("Version conflict for " + requestId + " (expected: " + expectedVersion + ", actual: " + actualVersion + ")");
        this.requestId = requestId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public RequestId getRequestId() {
        return requestId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
