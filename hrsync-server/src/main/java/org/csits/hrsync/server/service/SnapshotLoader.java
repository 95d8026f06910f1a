package org.csits.hrsync.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.manager.path.FieldPathDocuments;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.client.NamedListValue;
import org.csits.hrsync.server.dto.EnumLabelMap;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.IdentifierMap;
import org.csits.hrsync.server.dto.SyncConfig;
import org.csits.hrsync.server.dto.TickContext;
import org.springframework.stereotype.Service;

/**
 * 每次调度开始时从 HR 平台拉取人员与列表值快照，构建本次调度的查找表。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotLoader {

    static final String RECORD_ID_FIELD = "root.id";

    private final HrApiClient hrApiClient;
    private final RetryService retryService;
    private final SyncConfigService syncConfigService;

    /**
     * 人员快照失败时降级为空表（由逐行远程查询兜底）；列表值快照失败则抛出异常
     *
     * @throws HrApiException 列表值快照重试后仍失败
     * @throws InterruptedException 重试等待期间被中断
     */
    public TickContext load(FieldTarget target) throws InterruptedException {
        SyncConfig config = syncConfigService.getConfig();
        IdentifierMap identifiers;
        try {
            identifiers = retryService.executeWithRetry(
                () -> loadIdentifiers(config.getApi().getBusinessIdField()), config.getRetry(), "人员快照");
        } catch (HrApiException e) {
            log.warn("人员快照加载失败，降级为逐行远程查询: {}", e.getMessage());
            identifiers = IdentifierMap.empty();
        }

        EnumLabelMap enumLabels = null;
        if (target.hasEnumList()) {
            String listName = target.getEnumListName();
            enumLabels = retryService.executeWithRetry(
                () -> loadEnumLabels(listName), config.getRetry(), "列表值快照[" + listName + "]");
        }
        log.info("快照加载完成: identifiers={}, enumList={}, enumLabels={}",
            identifiers.size(), target.getEnumListName(), enumLabels != null ? enumLabels.size() : 0);
        return new TickContext(identifiers, enumLabels);
    }

    private IdentifierMap loadIdentifiers(String businessIdField) {
        List<JsonNode> people = hrApiClient.searchPeople(
            Arrays.asList(RECORD_ID_FIELD, businessIdField), null, null);
        Map<String, String> entries = new HashMap<>();
        int missing = 0;
        for (JsonNode person : people) {
            Optional<String> recordId = FieldPathDocuments.getAtPath(person, RECORD_ID_FIELD);
            Optional<String> businessId = FieldPathDocuments.getAtPath(person, businessIdField);
            if (recordId.isPresent() && businessId.isPresent()) {
                entries.putIfAbsent(businessId.get().trim(), recordId.get());
            } else {
                missing++;
            }
        }
        if (missing > 0) {
            log.debug("人员快照中 {} 条记录缺少业务标识或记录 ID", missing);
        }
        return IdentifierMap.of(entries);
    }

    private EnumLabelMap loadEnumLabels(String listName) {
        Map<String, String> idsByLabel = new HashMap<>();
        for (NamedListValue value : hrApiClient.fetchNamedList(listName)) {
            idsByLabel.putIfAbsent(value.getLabel(), value.getId());
        }
        return EnumLabelMap.of(listName, idsByLabel);
    }
}
