package org.csits.hrsync.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.manager.pacing.CallPacer;
import org.csits.hrsync.manager.path.FieldPathDocuments;
import org.csits.hrsync.server.client.HiBobApiClient;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.client.HrApiResponse;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.TickContext;
import org.csits.hrsync.server.dto.UpdateOutcome;
import org.springframework.stereotype.Service;

/**
 * 单行更新：解析标识、翻译值、写入、回读并分类结果。写入后无论成败都执行一次节流。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpdateExecutor {

    static final String IDENTIFIER_NOT_FOUND = "identifier not found";

    static final String RECORD_NOT_FOUND = "record or field not found";

    private final IdentifierResolver identifierResolver;
    private final ValueTranslator valueTranslator;
    private final HrApiClient hrApiClient;
    private final CallPacer callPacer;

    /**
     * 不修改入参行，由调用方将结果写回行表
     *
     * @throws InterruptedException 节流等待被中断
     */
    public UpdateOutcome execute(UpdateRowEntity row, FieldTarget target, TickContext context)
        throws InterruptedException {
        Optional<String> resolved;
        try {
            resolved = identifierResolver.resolve(row.getBusinessId(), context.getIdentifiers());
        } catch (HrApiException e) {
            return UpdateOutcome.failed(null, e.getStatusCode(), "identifier lookup failed: " + e.getMessage());
        }
        if (!resolved.isPresent()) {
            return UpdateOutcome.failed(null, null, IDENTIFIER_NOT_FOUND);
        }
        String recordId = resolved.get();
        String apiValue = valueTranslator.translate(row.getRawValue(), context.getEnumLabels());
        ObjectNode payload = FieldPathDocuments.buildPayload(target.getFieldPath(), apiValue);

        try {
            return writeAndVerify(row, recordId, target, payload);
        } finally {
            callPacer.pace();
        }
    }

    private UpdateOutcome writeAndVerify(UpdateRowEntity row, String recordId, FieldTarget target,
                                         ObjectNode payload) {
        HrApiResponse response;
        try {
            response = hrApiClient.updatePerson(recordId, payload);
        } catch (HrApiException e) {
            log.warn("行 {} 写入失败: recordId={}, error={}", row.getRowIndex(), recordId, e.getMessage());
            return UpdateOutcome.failed(recordId, e.getStatusCode(), e.getMessage());
        }

        int code = response.getStatusCode();
        if (response.isNotFound()) {
            return UpdateOutcome.failed(recordId, code, RECORD_NOT_FOUND);
        }
        if (!response.is2xxSuccessful() && !response.isNotModified()) {
            String message = "HTTP " + code + ": " + HiBobApiClient.snippet(response.getBody());
            log.warn("行 {} 写入被拒绝: recordId={}, {}", row.getRowIndex(), recordId, message);
            return UpdateOutcome.failed(recordId, code, message);
        }

        String verified = null;
        String readBackError = null;
        try {
            JsonNode person = hrApiClient.fetchPerson(recordId);
            verified = FieldPathDocuments.getAtPath(person, target.getFieldPath()).orElse(null);
        } catch (HrApiException e) {
            readBackError = "read-back failed: " + e.getMessage();
            log.warn("行 {} 回读失败: recordId={}, error={}", row.getRowIndex(), recordId, e.getMessage());
        }
        log.debug("行 {} 写入完成: recordId={}, code={}, verified={}", row.getRowIndex(), recordId, code, verified);
        return response.isNotModified()
            ? UpdateOutcome.skipped(recordId, code, verified, readBackError)
            : UpdateOutcome.completed(recordId, code, verified, readBackError);
    }
}
