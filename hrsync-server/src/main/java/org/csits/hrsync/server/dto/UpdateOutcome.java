package org.csits.hrsync.server.dto;

import lombok.Getter;
import lombok.ToString;
import org.csits.hrsync.dao.UpdateRowEntity;
import org.csits.hrsync.dao.UpdateRowStatus;

/**
 * 单行更新结果。
 */
@Getter
@ToString
public final class UpdateOutcome {

    private final UpdateRowStatus status;

    private final String resolvedRecordId;

    private final Integer httpCode;

    private final String errorMessage;

    private final String verifiedValue;

    private UpdateOutcome(UpdateRowStatus status, String resolvedRecordId, Integer httpCode,
                          String errorMessage, String verifiedValue) {
        this.status = status;
        this.resolvedRecordId = resolvedRecordId;
        this.httpCode = httpCode;
        this.errorMessage = errorMessage;
        this.verifiedValue = verifiedValue;
    }

    public static UpdateOutcome completed(String recordId, int httpCode, String verifiedValue, String readBackError) {
        return new UpdateOutcome(UpdateRowStatus.COMPLETED, recordId, httpCode, readBackError, verifiedValue);
    }

    public static UpdateOutcome skipped(String recordId, int httpCode, String verifiedValue, String readBackError) {
        return new UpdateOutcome(UpdateRowStatus.SKIPPED, recordId, httpCode, readBackError, verifiedValue);
    }

    public static UpdateOutcome failed(String recordId, Integer httpCode, String errorMessage) {
        return new UpdateOutcome(UpdateRowStatus.FAILED, recordId, httpCode, errorMessage, null);
    }

    /**
     * 将结果写入行的结果列，覆盖上一次执行留下的值
     */
    public void applyTo(UpdateRowEntity row) {
        row.setStatus(status.name());
        row.setResolvedRecordId(resolvedRecordId);
        row.setHttpCode(httpCode);
        row.setErrorMessage(errorMessage);
        row.setVerifiedValue(verifiedValue);
    }
}
