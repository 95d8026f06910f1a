package org.csits.hrsync.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * 同步配置，对应 conf/sync.yaml。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {

    private ApiConfig api = new ApiConfig();

    private BatchConfig batch = new BatchConfig();

    private PacingConfig pacing = new PacingConfig();

    private RetryConfig retry = new RetryConfig();

    /**
     * 可选字段目标目录，key 为目标名。
     */
    private Map<String, FieldTarget> targets = new LinkedHashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiConfig {

        @JsonProperty("base_url")
        private String baseUrl = "https://api.hibob.com/v1";

        /**
         * 业务标识所在字段路径，如 work.employeeIdInCompany。
         */
        @JsonProperty("business_id_field")
        private String businessIdField = "work.employeeIdInCompany";

        @JsonProperty("connect_timeout_ms")
        private Integer connectTimeoutMs = 5000;

        @JsonProperty("read_timeout_ms")
        private Integer readTimeoutMs = 30000;

        /**
         * 查询人员时是否包含离职人员。
         */
        @JsonProperty("show_inactive")
        private Boolean showInactive = Boolean.TRUE;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchConfig {

        /**
         * 单次调度处理的行数。
         */
        @JsonProperty("batch_size")
        private Integer batchSize = 45;

        /**
         * 两次调度之间的间隔（秒）。
         */
        @JsonProperty("tick_interval_sec")
        private Integer tickIntervalSec = 420;

        @JsonProperty("first_tick_delay_sec")
        private Integer firstTickDelaySec = 5;

        /**
         * 单次调度的时间预算（秒），超出后剩余行留到下次调度。
         */
        @JsonProperty("tick_time_budget_sec")
        private Integer tickTimeBudgetSec = 330;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PacingConfig {

        @JsonProperty("max_calls_per_minute")
        private Integer maxCallsPerMinute = 10;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {

        /**
         * 快照类调用失败后的重试次数。
         */
        @JsonProperty("max_retries")
        private Integer maxRetries = 2;

        /**
         * 重试间隔（秒）。
         */
        @JsonProperty("retry_interval_sec")
        private Integer retryIntervalSec = 10;
    }
}
