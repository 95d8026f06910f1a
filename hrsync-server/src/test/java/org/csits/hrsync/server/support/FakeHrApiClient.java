package org.csits.hrsync.server.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.client.HrApiException;
import org.csits.hrsync.server.client.HrApiResponse;
import org.csits.hrsync.server.client.NamedListValue;

/**
 * 内存版 HR 平台：人员按 work.employeeIdInCompany 建索引，写入后的文档可回读。
 */
public class FakeHrApiClient implements HrApiClient {

    private final Map<String, String> recordIdsByBusinessId = new LinkedHashMap<>();

    private final Map<String, Integer> writeCodes = new HashMap<>();

    private final Map<String, JsonNode> records = new HashMap<>();

    private final List<NamedListValue> listValues = new ArrayList<>();

    private final List<String> writes = new ArrayList<>();

    private final List<String> remoteLookups = new ArrayList<>();

    private boolean failPeopleSnapshot;

    private boolean failNamedList;

    private Runnable onWrite;

    public FakeHrApiClient person(String businessId, String recordId) {
        recordIdsByBusinessId.put(businessId, recordId);
        return this;
    }

    public FakeHrApiClient listValue(String id, String label) {
        listValues.add(new NamedListValue(id, label));
        return this;
    }

    public void respondToWrite(String recordId, int code) {
        writeCodes.put(recordId, code);
    }

    public void clearWriteResponse(String recordId) {
        writeCodes.remove(recordId);
    }

    public void setFailPeopleSnapshot(boolean failPeopleSnapshot) {
        this.failPeopleSnapshot = failPeopleSnapshot;
    }

    public void setFailNamedList(boolean failNamedList) {
        this.failNamedList = failNamedList;
    }

    public void setOnWrite(Runnable onWrite) {
        this.onWrite = onWrite;
    }

    public List<String> getWrites() {
        return writes;
    }

    public List<String> getRemoteLookups() {
        return remoteLookups;
    }

    public JsonNode record(String recordId) {
        return records.get(recordId);
    }

    @Override
    public List<JsonNode> searchPeople(List<String> fieldPaths, String filterFieldPath, String filterValue) {
        List<JsonNode> result = new ArrayList<>();
        if (filterFieldPath == null) {
            if (failPeopleSnapshot) {
                throw new HrApiException(503, "unavailable", "HTTP 503: unavailable");
            }
            recordIdsByBusinessId.forEach((bid, rid) -> result.add(personNode(bid, rid)));
            return result;
        }
        remoteLookups.add(filterValue);
        String rid = recordIdsByBusinessId.get(filterValue);
        if (rid != null) {
            result.add(personNode(filterValue, rid));
        }
        return result;
    }

    @Override
    public List<NamedListValue> fetchNamedList(String listName) {
        if (failNamedList) {
            throw new HrApiException(500, "boom", "HTTP 500: boom");
        }
        return new ArrayList<>(listValues);
    }

    @Override
    public HrApiResponse updatePerson(String recordId, JsonNode payload) {
        writes.add(recordId);
        if (onWrite != null) {
            onWrite.run();
        }
        int code = writeCodes.getOrDefault(recordId, 200);
        if (code == 404) {
            return new HrApiResponse(404, "{\"error\":\"Not Found\"}");
        }
        if (code >= 200 && code < 300) {
            records.put(recordId, payload.deepCopy());
        }
        return new HrApiResponse(code, code >= 400 ? "{\"error\":\"rejected\"}" : "");
    }

    @Override
    public JsonNode fetchPerson(String recordId) {
        JsonNode doc = records.get(recordId);
        return doc != null ? doc : JsonNodeFactory.instance.objectNode();
    }

    private static JsonNode personNode(String businessId, String recordId) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", recordId);
        node.putObject("work").put("employeeIdInCompany", businessId);
        return node;
    }
}
