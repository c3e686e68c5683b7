package schedulerapp.service;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;
import schedulerapp.domain.Schedule;
import schedulerapp.domain.ScheduledTask;
import schedulerapp.exception.PeriodicTaskNotFoundException;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;
import schedulerapp.persistence.store.ScheduleStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the transaction and retry behaviour of {@link PeriodicTaskService}.
 *
 * <p>The controller and store are mocked; the transaction manager hands out plain
 * {@link SimpleTransactionStatus} instances so commits and rollbacks can be counted.
 */
@ExtendWith(MockitoExtension.class)
class PeriodicTaskServiceTest {

    private static final ScheduledTask REQUEST = new ScheduledTask(
            "cleanup", "maintenance.cleanup", Schedule.daily("0", "3", "UTC"));

    @Mock
    private ScheduleController controller;
    @Mock
    private ScheduleStore store;
    @Mock
    private PlatformTransactionManager transactionManager;

    private PeriodicTaskService service;
    private PeriodicTask task;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(invocation -> new SimpleTransactionStatus());
        service = newService(1);
        task = new PeriodicTask("cleanup", "maintenance.cleanup", "{}",
                new CrontabSchedule(REQUEST.schedule()), Instant.EPOCH);
    }

    private PeriodicTaskService newService(final int retries) {
        return new PeriodicTaskService(controller, store, null, transactionManager, retries);
    }

    // ==================== Conflict Retry Tests ====================

    @Test
    void scheduleTask_rerunsOnceAfterScheduleConflict() {
        when(controller.scheduleTask(eq(REQUEST), any()))
                .thenThrow(new DataIntegrityViolationException("uk_crontab_schedules_fields"))
                .thenReturn(task);

        final PeriodicTask result = service.scheduleTask(REQUEST, Map.of());

        assertThat(result).isSameAs(task);
        verify(controller, times(2)).scheduleTask(eq(REQUEST), any());
        verify(transactionManager).rollback(any());
        verify(transactionManager).commit(any());
        verify(store).flush();
    }

    @Test
    void scheduleTask_givesUpWhenRetriesExhausted() {
        when(controller.scheduleTask(eq(REQUEST), any()))
                .thenThrow(new DataIntegrityViolationException("first"))
                .thenThrow(new DataIntegrityViolationException("second"));

        assertThatThrownBy(() -> service.scheduleTask(REQUEST, Map.of()))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessage("second");
        verify(controller, times(2)).scheduleTask(eq(REQUEST), any());
    }

    @Test
    void scheduleTask_zeroRetriesPropagatesFirstConflict() {
        final PeriodicTaskService noRetry = newService(0);
        when(controller.scheduleTask(eq(REQUEST), any()))
                .thenThrow(new DataIntegrityViolationException("conflict"));

        assertThatThrownBy(() -> noRetry.scheduleTask(REQUEST, null))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(controller, times(1)).scheduleTask(eq(REQUEST), any());
    }

    @Test
    void updateTask_retriesConflictFromFlush() {
        when(controller.updateTask(REQUEST, 4L)).thenReturn(task);
        doThrow(new DataIntegrityViolationException("conflict"))
                .doNothing()
                .when(store).flush();

        final PeriodicTask result = service.updateTask(REQUEST, 4L);

        assertThat(result).isSameAs(task);
        verify(controller, times(2)).updateTask(REQUEST, 4L);
    }

    @Test
    void otherStoreFailuresAreNotRetried() {
        when(controller.scheduleTask(eq(REQUEST), any()))
                .thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> service.scheduleTask(REQUEST, Map.of()))
                .isInstanceOf(QueryTimeoutException.class);
        verify(controller, times(1)).scheduleTask(eq(REQUEST), any());
    }

    @Test
    void notFoundIsNotRetriedAndRollsBack() {
        when(controller.deleteTask(12L)).thenThrow(new PeriodicTaskNotFoundException(12L));

        assertThatThrownBy(() -> service.deleteTask(12L))
                .isInstanceOf(PeriodicTaskNotFoundException.class);
        verify(transactionManager).rollback(any());
    }

    // ==================== Transaction Boundary Tests ====================

    @Test
    void writesRunInTheirOwnTransaction() {
        when(controller.deleteTask(5L)).thenReturn(task);

        service.deleteTask(5L);

        final ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Test
    void eachConflictAttemptGetsAFreshTransaction() {
        when(controller.scheduleTask(eq(REQUEST), any()))
                .thenThrow(new DataIntegrityViolationException("conflict"))
                .thenReturn(task);

        service.scheduleTask(REQUEST, null);

        final ArgumentCaptor<TransactionDefinition> definitions = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager, times(2)).getTransaction(definitions.capture());
        assertThat(definitions.getAllValues())
                .extracting(TransactionDefinition::getPropagationBehavior)
                .containsOnly(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Test
    void readsJoinSurroundingTransaction() {
        final CrontabSchedule crontab = task.getCrontab();
        when(controller.crontabIsUsed(crontab)).thenReturn(true);

        assertThat(service.crontabIsUsed(crontab)).isTrue();

        final ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRED);
        assertThat(definition.getValue().isReadOnly()).isTrue();
    }

    @Test
    void negativeRetryCountIsRejected() {
        assertThatThrownBy(() -> newService(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be negative");
    }
}
