package org.csits.hrsync.server.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.manager.path.FieldPathDocuments;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HiBob 接口实现。RestTemplate 需配置为不对错误状态码抛异常，状态码在这里统一分类。
 */
@Slf4j
public class HiBobApiClient implements HrApiClient {

    static final int MAX_BODY_SNIPPET = 500;

    private final RestTemplate restTemplate;

    private final ApiCredentialProvider credentialProvider;

    private final ObjectMapper objectMapper;

    private final boolean showInactive;

    public HiBobApiClient(RestTemplate restTemplate, ApiCredentialProvider credentialProvider,
                          ObjectMapper objectMapper, boolean showInactive) {
        this.restTemplate = restTemplate;
        this.credentialProvider = credentialProvider;
        this.objectMapper = objectMapper;
        this.showInactive = showInactive;
    }

    @Override
    public List<JsonNode> searchPeople(List<String> fieldPaths, String filterFieldPath, String filterValue) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode fields = body.putArray("fields");
        for (String path : fieldPaths) {
            fields.add(toApiFieldPath(path));
        }
        body.put("showInactive", showInactive);
        if (filterFieldPath != null) {
            ObjectNode filter = body.putArray("filters").addObject();
            filter.put("fieldPath", toApiFieldPath(filterFieldPath));
            filter.put("operator", "equals");
            filter.putArray("values").add(filterValue);
        }
        JsonNode response = readJson(exchange("/people/search", HttpMethod.POST, body, true), "/people/search");
        JsonNode employees = response.path("employees");
        if (!employees.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> result = new ArrayList<>(employees.size());
        employees.forEach(result::add);
        return result;
    }

    @Override
    public List<NamedListValue> fetchNamedList(String listName) {
        String path = "/company/named-lists/" + listName;
        JsonNode response = readJson(exchange(path, HttpMethod.GET, null, true), path);
        List<NamedListValue> values = new ArrayList<>();
        flatten(response.path("values"), values);
        return values;
    }

    @Override
    public HrApiResponse updatePerson(String recordId, JsonNode payload) {
        ResponseEntity<String> response = exchange("/people/" + recordId, HttpMethod.PUT, payload, false);
        return new HrApiResponse(response.getStatusCodeValue(), response.getBody());
    }

    @Override
    public JsonNode fetchPerson(String recordId) {
        String path = "/people/" + recordId;
        return readJson(exchange(path, HttpMethod.GET, null, true), path);
    }

    private ResponseEntity<String> exchange(String path, HttpMethod method, JsonNode body, boolean requireSuccess) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, credentialProvider.authorizationHeader());
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        String payload = null;
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
            payload = body.toString();
        }
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(path, method, new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientException e) {
            throw new HrApiException(method + " " + path + " failed: " + e.getMessage(), e);
        }
        int code = response.getStatusCodeValue();
        log.debug("HR 平台调用: {} {} -> {}", method, path, code);
        if (requireSuccess && (code < 200 || code >= 300)) {
            String snippet = snippet(response.getBody());
            throw new HrApiException(code, response.getBody(), "HTTP " + code + ": " + snippet);
        }
        return response;
    }

    private JsonNode readJson(ResponseEntity<String> response, String path) {
        String body = response.getBody();
        if (body == null || body.trim().isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new HrApiException(response.getStatusCodeValue(), body,
                "invalid JSON from " + path + ": " + snippet(body));
        }
    }

    private static void flatten(JsonNode items, List<NamedListValue> out) {
        if (!items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            String id = item.path("id").asText(null);
            String label = item.hasNonNull("value") ? item.get("value").asText() : item.path("name").asText(null);
            if (id != null && label != null) {
                out.add(new NamedListValue(id, label));
            }
            flatten(item.path("children"), out);
        }
    }

    /**
     * 转为接口使用的斜杠路径，顶层字段带 root 前缀，如 /root/id、/work/department
     */
    static String toApiFieldPath(String fieldPath) {
        List<String> segments = FieldPathDocuments.segments(fieldPath);
        if (segments.size() == 1 && !"root".equals(segments.get(0))) {
            return "/root/" + segments.get(0);
        }
        return "/" + String.join("/", segments);
    }

    /**
     * 截断响应体，用于错误信息
     */
    public static String snippet(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        return trimmed.length() <= MAX_BODY_SNIPPET ? trimmed : trimmed.substring(0, MAX_BODY_SNIPPET) + "...";
    }
}
