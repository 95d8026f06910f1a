package org.csits.hrsync.server.client;

/**
 * HR 平台调用失败：非 2xx 响应或传输层异常。传输层异常时 statusCode 为空。
 */
public class HrApiException extends RuntimeException {

    private final Integer statusCode;

    private final String responseBody;

    public HrApiException(Integer statusCode, String responseBody, String message) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public HrApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
        this.responseBody = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
