package org.csits.hrsync.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.Collections;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.client.NamedListValue;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.SyncConfig;
import org.csits.hrsync.server.dto.TickContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SnapshotLoaderTest {

    @Mock
    private HrApiClient hrApiClient;

    @Mock
    private SyncConfigService syncConfigService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SyncConfig config;

    private SnapshotLoader loader;

    @BeforeEach
    void setUp() {
        config = new SyncConfig();
        config.getRetry().setMaxRetries(1);
        config.getRetry().setRetryIntervalSec(0);
        when(syncConfigService.getConfig()).thenReturn(config);
        loader = new SnapshotLoader(hrApiClient, new RetryService(), syncConfigService);
    }

    @Test
    void load_buildsIdentifierAndEnumMaps() throws Exception {
        when(hrApiClient.searchPeople(anyList(), isNull(), isNull())).thenReturn(Arrays.asList(
            objectMapper.readTree("{\"id\":\"rec-1\",\"work\":{\"employeeIdInCompany\":\"E001\"}}"),
            objectMapper.readTree("{\"id\":\"rec-2\",\"work\":{\"employeeIdInCompany\":{\"value\":\"E002\"}}}"),
            objectMapper.readTree("{\"id\":\"rec-3\"}")));
        when(hrApiClient.fetchNamedList("department")).thenReturn(Arrays.asList(
            new NamedListValue("d-sales", "Sales"), new NamedListValue("d-rd", "R&D")));

        TickContext context = loader.load(new FieldTarget("work.department", "list", "department"));

        assertThat(context.getIdentifiers().size()).isEqualTo(2);
        assertThat(context.getIdentifiers().lookup("E002")).contains("rec-2");
        assertThat(context.getEnumLabels().lookup("r&d")).contains("d-rd");
    }

    @Test
    void load_peopleSnapshotFailure_degradesToEmptyMap() throws Exception {
        when(hrApiClient.searchPeople(anyList(), isNull(), isNull()))
            .thenThrow(new HrApiException(503, "", "HTTP 503: "));

        TickContext context = loader.load(FieldTarget.of("root.displayName"));

        assertThat(context.getIdentifiers().size()).isZero();
        assertThat(context.getEnumLabels()).isNull();
        verify(hrApiClient, times(2)).searchPeople(anyList(), isNull(), isNull());
        verify(hrApiClient, never()).fetchNamedList(anyString());
    }

    @Test
    void load_enumListFailure_throwsAfterRetries() {
        when(hrApiClient.searchPeople(anyList(), isNull(), isNull())).thenReturn(Collections.emptyList());
        when(hrApiClient.fetchNamedList("department")).thenThrow(new HrApiException(500, "", "HTTP 500: "));

        assertThatThrownBy(() -> loader.load(new FieldTarget("work.department", "list", "department")))
            .isInstanceOf(HrApiException.class);
        verify(hrApiClient, times(2)).fetchNamedList("department");
    }
}
