package org.csits.hrsync;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.service.BatchJobService;
import org.csits.hrsync.server.service.SyncConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HrSyncApplicationTest {

    @Mock
    private SyncConfigService syncConfigService;

    @Mock
    private BatchJobService batchJobService;

    private HrSyncApplication application;

    @BeforeEach
    void setUp() {
        application = new HrSyncApplication(syncConfigService, batchJobService);
    }

    @Test
    void run_withTarget_startsJob() {
        FieldTarget department = new FieldTarget("work.department", "list", "department");
        when(syncConfigService.resolveTarget("department")).thenReturn(department);
        when(batchJobService.startJob(department)).thenReturn(new JobRunEntity());

        application.run("--spring.profiles.active=memory", "--target=department");

        verify(batchJobService).startJob(department);
    }

    @Test
    void run_withoutTarget_staysResident() {
        application.run("--spring.profiles.active=memory");

        verify(batchJobService, never()).startJob(any());
    }

    @Test
    void run_whileJobActive_doesNotStartAnother() {
        when(batchJobService.isJobActive()).thenReturn(true);

        application.run("--target=department");

        verify(batchJobService, never()).startJob(any());
        verify(syncConfigService, never()).resolveTarget(any());
    }
}
