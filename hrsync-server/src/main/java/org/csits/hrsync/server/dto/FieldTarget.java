package org.csits.hrsync.server.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.csits.hrsync.manager.path.FieldPathDocuments;

/**
 * 批量更新的目标字段，作业期间不可变。
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FieldTarget {

    @JsonProperty("field_path")
    private final String fieldPath;

    @JsonProperty("field_type")
    private final String fieldType;

    /**
     * 枚举字段对应的列表名，非枚举字段为空。
     */
    @JsonProperty("enum_list_name")
    private final String enumListName;

    @JsonCreator
    public FieldTarget(@JsonProperty("field_path") String fieldPath,
                       @JsonProperty("field_type") String fieldType,
                       @JsonProperty("enum_list_name") String enumListName) {
        FieldPathDocuments.segments(fieldPath);
        this.fieldPath = fieldPath.trim();
        this.fieldType = isBlank(fieldType) ? null : fieldType.trim();
        this.enumListName = isBlank(enumListName) ? null : enumListName.trim();
    }

    public static FieldTarget of(String fieldPath) {
        return new FieldTarget(fieldPath, null, null);
    }

    public boolean hasEnumList() {
        return enumListName != null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
