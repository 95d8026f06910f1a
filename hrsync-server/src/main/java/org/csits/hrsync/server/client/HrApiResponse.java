package org.csits.hrsync.server.client;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 写接口的原始响应，状态码由调用方分类。
 */
@Data
@AllArgsConstructor
public class HrApiResponse {

    private int statusCode;

    private String body;

    public boolean is2xxSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotModified() {
        return statusCode == 304;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
