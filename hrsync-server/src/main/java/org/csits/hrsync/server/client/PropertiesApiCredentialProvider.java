package org.csits.hrsync.server.client;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 从应用配置读取凭据：配置了服务账号 ID 时使用 Basic（id:token），否则使用 Bearer token。
 */
@Slf4j
@Component
public class PropertiesApiCredentialProvider implements ApiCredentialProvider {

    private final String serviceUserId;

    private final String token;

    public PropertiesApiCredentialProvider(@Value("${hrsync.api.service-user-id:}") String serviceUserId,
                                           @Value("${hrsync.api.token:}") String token) {
        this.serviceUserId = serviceUserId == null ? "" : serviceUserId.trim();
        this.token = token == null ? "" : token.trim();
        if (this.token.isEmpty()) {
            log.warn("未配置 hrsync.api.token，HR 平台调用将被拒绝");
        }
    }

    @Override
    public String authorizationHeader() {
        if (!serviceUserId.isEmpty()) {
            String raw = serviceUserId + ":" + token;
            return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        }
        return "Bearer " + token;
    }
}
