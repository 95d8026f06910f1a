package org.csits.hrsync.web.controller;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeMap;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.server.exception.JobAlreadyRunningException;
import org.csits.hrsync.server.service.RowStatusReporter;
import org.csits.hrsync.server.service.UpdateRowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = UpdateRowController.class)
class UpdateRowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UpdateRowService updateRowService;

    @MockBean
    private RowStatusReporter rowStatusReporter;

    @Test
    void stage_returnsCountAndFirstIndex() throws Exception {
        UpdateRowEntity a = UpdateRowEntity.staged("E001", "Sales");
        a.setRowIndex(10);
        UpdateRowEntity b = UpdateRowEntity.staged("E002", "R&D");
        b.setRowIndex(11);
        when(updateRowService.stage(anyList())).thenReturn(Arrays.asList(a, b));
        when(updateRowService.count()).thenReturn(12L);

        mockMvc.perform(post("/api/rows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"businessId\":\"E001\",\"rawValue\":\"Sales\"},{\"businessId\":\"E002\",\"rawValue\":\"R&D\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.staged").value(2))
            .andExpect(jsonPath("$.firstRowIndex").value(10))
            .andExpect(jsonPath("$.total").value(12));
    }

    @Test
    void stage_whileJobActive_returns409() throws Exception {
        when(updateRowService.stage(anyList())).thenThrow(new JobAlreadyRunningException("批量作业执行中，不能暂存行表"));

        mockMvc.perform(post("/api/rows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"businessId\":\"E001\",\"rawValue\":\"Sales\"}]"))
            .andExpect(status().isConflict());
    }

    @Test
    void list_passesFilterAndPaging() throws Exception {
        UpdateRowEntity failed = UpdateRowEntity.staged("E030", "Sales");
        failed.setRowIndex(30);
        failed.setStatus("FAILED");
        failed.setHttpCode(404);
        when(updateRowService.list("FAILED", 0, 10)).thenReturn(Collections.singletonList(failed));
        when(updateRowService.count()).thenReturn(47L);

        mockMvc.perform(get("/api/rows").param("status", "FAILED").param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(47))
            .andExpect(jsonPath("$.data[0].rowIndex").value(30))
            .andExpect(jsonPath("$.data[0].httpCode").value(404));
    }

    @Test
    void summary_returnsCountsPerStatus() throws Exception {
        TreeMap<String, Long> counts = new TreeMap<>();
        counts.put("COMPLETED", 46L);
        counts.put("FAILED", 1L);
        when(rowStatusReporter.summarize()).thenReturn(counts);

        mockMvc.perform(get("/api/rows/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.COMPLETED").value(46))
            .andExpect(jsonPath("$.FAILED").value(1));
    }

    @Test
    void clear_whileJobActive_returns409() throws Exception {
        doThrow(new JobAlreadyRunningException("批量作业执行中，不能清空行表")).when(updateRowService).clear();

        mockMvc.perform(delete("/api/rows"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("批量作业执行中，不能清空行表"));
    }
}
