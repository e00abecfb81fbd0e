package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.adapter.runner.ResilienceConfig;
import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for audit writes under the production resilience defaults.
 *
 * <p>Audit writes run on the calling thread while the request lock is held, so a failing
 * audit store must cost the caller no backoff delay.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class AuditDefaultPolicyContractTest extends AbstractContractTest {

    @Override
    protected ResilienceConfig resilienceConfig() {
        return new ResilienceConfig();
    }

    @Test
    void testAuditWriteFailure_WhenStoreDownOnCreate_NoBackoffDelay() {
        // Given
        auditStore.failNextAppends(3);

        // When
        long started = System.nanoTime();
        ServiceRequest created = createConnectionRequest();
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertTrue(elapsedMillis < 1_000,
                String.format("Create waited %dms on a failing audit store", elapsedMillis));
        assertEquals(1, orchestrator.auditWriteFailureCount());
        assertStoredVersion(created.id(), 1L);
    }

    @Test
    void testAuditWriteFailure_WhenStoreDownOnTransition_NoBackoffDelay() {
        // Given
        ServiceRequest created = createConnectionRequest();
        auditStore.failNextAppends(3);

        // When
        long started = System.nanoTime();
        ServiceRequest advanced = assertTransitioned(transition(created.id(), MANAGER_ACTOR, Action.ADVANCE));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertTrue(elapsedMillis < 1_000,
                String.format("Transition waited %dms on a failing audit store", elapsedMillis));
        assertEquals(Role.JUNIOR_MANAGER, advanced.currentRole());
        assertEquals(1, orchestrator.auditWriteFailureCount());
    }
}
