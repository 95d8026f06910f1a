package org.csits.hrsync.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.dto.SyncConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class YamlConfigLoaderTest {

    private YamlConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlConfigLoader();
    }

    @Test
    void loadSyncConfig_parsesKeyFields() throws IOException {
        SyncConfig config = loader.loadSyncConfig(new ClassPathResource("conf/sync.yaml"));

        assertThat(config.getApi().getBaseUrl()).isEqualTo("https://hr.example.test/v1");
        assertThat(config.getApi().getBusinessIdField()).isEqualTo("work.employeeIdInCompany");
        assertThat(config.getBatch().getBatchSize()).isEqualTo(45);
        assertThat(config.getBatch().getTickIntervalSec()).isEqualTo(420);
        assertThat(config.getBatch().getTickTimeBudgetSec()).isEqualTo(330);
        assertThat(config.getPacing().getMaxCallsPerMinute()).isEqualTo(10);
        assertThat(config.getRetry().getMaxRetries()).isEqualTo(1);

        FieldTarget department = config.getTargets().get("department");
        assertThat(department.getFieldPath()).isEqualTo("work.department");
        assertThat(department.getEnumListName()).isEqualTo("department");
        assertThat(config.getTargets().get("display_name").hasEnumList()).isFalse();
    }

    @Test
    void loadSyncConfigFromString_missingSectionsKeepDefaults() throws IOException {
        SyncConfig config = loader.loadSyncConfigFromString("batch:\n  batch_size: 20\nunknown_key: 1\n");

        assertThat(config.getBatch().getBatchSize()).isEqualTo(20);
        assertThat(config.getBatch().getTickIntervalSec()).isEqualTo(420);
        assertThat(config.getPacing().getMaxCallsPerMinute()).isEqualTo(10);
        assertThat(config.getTargets()).isEmpty();
    }

    @Test
    void loadSyncConfigFromString_invalidFieldPathIsRejected() {
        String yaml = "targets:\n  broken:\n    field_path: \"work..department\"\n";

        assertThatThrownBy(() -> loader.loadSyncConfigFromString(yaml)).isInstanceOf(IOException.class);
    }
}
