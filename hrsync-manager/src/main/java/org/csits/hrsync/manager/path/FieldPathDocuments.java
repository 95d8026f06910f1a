package org.csits.hrsync.manager.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 按字段路径读写嵌套 JSON 文档。
 * <p>
 * 路径以点或斜杠分隔，如 {@code work.department}、{@code /work/department}。
 * 首段为 {@code root} 时表示顶层字段，{@code root.displayName} 等价于 {@code displayName}。
 */
public final class FieldPathDocuments {

    private static final String ROOT_SEGMENT = "root";

    private FieldPathDocuments() {
    }

    /**
     * 解析字段路径为段列表
     *
     * @throws IllegalArgumentException 路径为空或含空段
     */
    public static List<String> segments(String fieldPath) {
        if (fieldPath == null || fieldPath.trim().isEmpty()) {
            throw new IllegalArgumentException("field path is empty");
        }
        String normalized = fieldPath.trim();
        String separator = normalized.indexOf('/') >= 0 ? "/" : "\\.";
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        List<String> result = new ArrayList<>();
        for (String part : normalized.split(separator, -1)) {
            String segment = part.trim();
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("field path has an empty segment: " + fieldPath);
            }
            result.add(segment);
        }
        if (result.size() > 1 && ROOT_SEGMENT.equals(result.get(0))) {
            result.remove(0);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 在文档中按路径写入值，中间段不存在或不是对象时建为对象。
     */
    public static ObjectNode setAtPath(ObjectNode document, String fieldPath, String value) {
        List<String> segments = segments(fieldPath);
        ObjectNode current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = current.get(segments.get(i));
            if (child instanceof ObjectNode) {
                current = (ObjectNode) child;
            } else {
                current = current.putObject(segments.get(i));
            }
        }
        String leaf = segments.get(segments.size() - 1);
        if (value == null) {
            current.putNull(leaf);
        } else {
            current.put(leaf, value);
        }
        return document;
    }

    /**
     * 生成只包含单个字段的更新请求体
     */
    public static ObjectNode buildPayload(String fieldPath, String value) {
        return setAtPath(JsonNodeFactory.instance.objectNode(), fieldPath, value);
    }

    /**
     * 按路径读取值。叶子为对象且含 {@code value} 属性时取其文本（HR 平台读接口的包装形式）。
     *
     * @return 路径不存在或值为 null 时返回空
     */
    public static Optional<String> getAtPath(JsonNode document, String fieldPath) {
        if (document == null) {
            return Optional.empty();
        }
        JsonNode current = document;
        for (String segment : segments(fieldPath)) {
            current = current.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        if (current.isObject() && current.has("value")) {
            current = current.get("value");
        }
        if (current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current.isValueNode() ? current.asText() : current.toString());
    }
}
