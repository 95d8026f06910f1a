package org.csits.hrsync.job;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.csits.hrsync.server.dto.RetrySummary;
import org.csits.hrsync.server.dto.TickResult;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.csits.hrsync.server.service.BatchJobService;
import org.csits.hrsync.server.service.RowStatusReporter;
import org.csits.hrsync.server.service.SyncConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * 不在调度中心上下文中执行，XxlJobHelper 的日志与结果上报均为空操作。
 */
@ExtendWith(MockitoExtension.class)
class HrSyncXxlJobHandlerTest {

    @Mock
    private BatchJobService batchJobService;

    @Mock
    private RowStatusReporter rowStatusReporter;

    @Mock
    private SyncConfigService syncConfigService;

    private HrSyncXxlJobHandler handler;

    @BeforeEach
    void setUp() {
        handler = new HrSyncXxlJobHandler(batchJobService, rowStatusReporter, syncConfigService);
    }

    @Test
    void tick_delegatesToBatchJobService() {
        when(batchJobService.tick()).thenReturn(TickResult.of(TickResult.Outcome.IDLE, "无进行中的作业"));

        handler.tick();

        verify(batchJobService).tick();
    }

    @Test
    void tick_rethrowsUnexpectedFailure() {
        when(batchJobService.tick()).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> handler.tick()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void retryFailed_withoutParam_usesLatestTarget() {
        when(rowStatusReporter.retryFailedRows()).thenReturn(new RetrySummary());

        handler.retryFailed();

        verify(rowStatusReporter).retryFailedRows();
    }

    @Test
    void retryFailed_whileJobActive_fails() {
        when(rowStatusReporter.retryFailedRows()).thenThrow(new JobAlreadyRunningException("批量作业执行中"));

        assertThatThrownBy(() -> handler.retryFailed()).isInstanceOf(JobAlreadyRunningException.class);
    }
}
