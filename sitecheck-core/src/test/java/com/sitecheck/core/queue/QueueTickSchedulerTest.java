package com.sitecheck.core.queue;

import com.sitecheck.core.queue.model.TickOutcome;
import com.sitecheck.core.queue.model.TickResult;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueTickSchedulerTest {

    private final AuditQueueCoordinator coordinator = mock(AuditQueueCoordinator.class);
    private final QueueTickScheduler scheduler = new QueueTickScheduler(coordinator);

    @Test
    void runsOneTickPerInvocation() {
        when(coordinator.processNext()).thenReturn(TickResult.of(TickOutcome.IDLE, null, null, null));

        scheduler.tick();
        scheduler.tick();

        verify(coordinator, times(2)).processNext();
    }

    @Test
    void storeFailureDoesNotEscapeTheScheduler() {
        when(coordinator.processNext()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(scheduler::tick).doesNotThrowAnyException();
    }
}
