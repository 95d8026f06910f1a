package org.csits.hrsync.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.manager.pacing.CallPacer;
import org.csits.hrsync.manager.path.FieldPathDocuments;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.dto.IdentifierMap;
import org.springframework.stereotype.Service;

/**
 * 业务标识解析：先查本地快照，未命中时远程按标识查询一次。不修改快照。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentifierResolver {

    private final HrApiClient hrApiClient;
    private final CallPacer callPacer;
    private final SyncConfigService syncConfigService;

    /**
     * @return 记录 ID，本地与远程均未找到时为空
     * @throws org.csits.hrsync.server.client.HrApiException 远程查询失败
     * @throws InterruptedException 远程查询后的节流等待被中断
     */
    public Optional<String> resolve(String businessId, IdentifierMap identifiers) throws InterruptedException {
        if (businessId == null || businessId.trim().isEmpty()) {
            return Optional.empty();
        }
        Optional<String> local = identifiers.lookup(businessId);
        if (local.isPresent()) {
            return local;
        }
        String key = businessId.trim();
        String businessIdField = syncConfigService.getConfig().getApi().getBusinessIdField();
        List<JsonNode> matches;
        try {
            matches = hrApiClient.searchPeople(
                Collections.singletonList(SnapshotLoader.RECORD_ID_FIELD), businessIdField, key);
        } finally {
            callPacer.pace();
        }
        for (JsonNode match : matches) {
            Optional<String> recordId = FieldPathDocuments.getAtPath(match, SnapshotLoader.RECORD_ID_FIELD);
            if (recordId.isPresent()) {
                log.debug("远程解析业务标识: {} -> {}", key, recordId.get());
                return recordId;
            }
        }
        log.debug("业务标识未找到: {}", key);
        return Optional.empty();
    }
}
