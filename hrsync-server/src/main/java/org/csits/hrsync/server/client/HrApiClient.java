package org.csits.hrsync.server.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * HR 平台接口。
 */
public interface HrApiClient {

    /**
     * 人员查询。filterFieldPath 为空时返回全量快照，否则按 equals 过滤。
     *
     * @param fieldPaths 需要返回的字段路径
     * @throws HrApiException 非 2xx 或传输失败
     */
    List<JsonNode> searchPeople(List<String> fieldPaths, String filterFieldPath, String filterValue);

    /**
     * 读取命名列表的全部值，子级展开为平铺列表。
     *
     * @throws HrApiException 非 2xx 或传输失败
     */
    List<NamedListValue> fetchNamedList(String listName);

    /**
     * 局部更新人员记录。非 2xx 响应原样返回，不抛异常。
     *
     * @throws HrApiException 仅在传输失败时抛出
     */
    HrApiResponse updatePerson(String recordId, JsonNode payload);

    /**
     * 读取单个人员记录，用于写后回读。
     *
     * @throws HrApiException 非 2xx 或传输失败
     */
    JsonNode fetchPerson(String recordId);
}
