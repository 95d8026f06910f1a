package org.csits.hrsync.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 待更新行实体，对应 update_row（上传表中的一行）。
 */
@Data
public class UpdateRowEntity {

    /** 行号，从 0 开始连续编号 */
    private Integer rowIndex;

    /** 业务标识（如公司内员工编号） */
    private String businessId;

    /** 运营填写的原始值，可能是枚举显示名 */
    private String rawValue;

    /** 解析得到的 HR 平台内部记录 ID */
    private String resolvedRecordId;

    private String status;

    private Integer httpCode;

    private String errorMessage;

    /** 写入后回读得到的值 */
    private String verifiedValue;

    /** 当前结果所针对的字段路径 */
    private String fieldPath;

    private LocalDateTime updatedAt;

    public static UpdateRowEntity staged(String businessId, String rawValue) {
        UpdateRowEntity e = new UpdateRowEntity();
        e.setBusinessId(businessId);
        e.setRawValue(rawValue);
        e.setStatus(UpdateRowStatus.PENDING.name());
        return e;
    }

    public UpdateRowStatus statusValue() {
        return status != null ? UpdateRowStatus.valueOf(status) : UpdateRowStatus.PENDING;
    }

    public UpdateRowEntity copy() {
        UpdateRowEntity e = new UpdateRowEntity();
        e.setRowIndex(rowIndex);
        e.setBusinessId(businessId);
        e.setRawValue(rawValue);
        e.setResolvedRecordId(resolvedRecordId);
        e.setStatus(status);
        e.setHttpCode(httpCode);
        e.setErrorMessage(errorMessage);
        e.setVerifiedValue(verifiedValue);
        e.setFieldPath(fieldPath);
        e.setUpdatedAt(updatedAt);
        return e;
    }
}
