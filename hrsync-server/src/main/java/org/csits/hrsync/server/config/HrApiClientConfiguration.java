package org.csits.hrsync.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.manager.pacing.CallPacer;
import org.csits.hrsync.manager.pacing.FixedDelayCallPacer;
import org.csits.hrsync.server.client.ApiCredentialProvider;
import org.csits.hrsync.server.client.HiBobApiClient;
import org.csits.hrsync.server.client.HrApiClient;
import org.csits.hrsync.server.dto.SyncConfig;
import org.csits.hrsync.server.service.SyncConfigService;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

/**
 * HR 平台客户端与调用节流装配。
 */
@Slf4j
@Configuration
public class HrApiClientConfiguration {

    @Bean
    public RestTemplate hrApiRestTemplate(RestTemplateBuilder builder, SyncConfigService syncConfigService) {
        SyncConfig.ApiConfig api = syncConfigService.getConfig().getApi();
        log.info("HR 平台地址: {}", api.getBaseUrl());
        return builder
            .rootUri(api.getBaseUrl())
            .setConnectTimeout(Duration.ofMillis(api.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(api.getReadTimeoutMs()))
            .errorHandler(new PassThroughErrorHandler())
            .build();
    }

    @Bean
    public HrApiClient hrApiClient(RestTemplate hrApiRestTemplate, ApiCredentialProvider credentialProvider,
                                   ObjectMapper objectMapper, SyncConfigService syncConfigService) {
        boolean showInactive = !Boolean.FALSE.equals(syncConfigService.getConfig().getApi().getShowInactive());
        return new HiBobApiClient(hrApiRestTemplate, credentialProvider, objectMapper, showInactive);
    }

    @Bean
    public CallPacer callPacer(SyncConfigService syncConfigService) {
        int perMinute = syncConfigService.getConfig().getPacing().getMaxCallsPerMinute();
        FixedDelayCallPacer pacer = FixedDelayCallPacer.perMinute(perMinute);
        log.info("调用节流: 每分钟最多 {} 次, 间隔 {} ms", perMinute, pacer.intervalMillis());
        return pacer;
    }

    /**
     * 状态码由客户端自行分类，不在这里抛异常
     */
    public static class PassThroughErrorHandler extends DefaultResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}
