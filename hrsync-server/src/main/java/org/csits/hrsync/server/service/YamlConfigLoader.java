package org.csits.hrsync.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.SyncConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将配置文件映射为 Java 对象。
 */
@Slf4j
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public SyncConfig loadSyncConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            SyncConfig config = yamlMapper.readValue(in, SyncConfig.class);
            log.debug("加载同步配置: {}", resource.getDescription());
            return config != null ? config : new SyncConfig();
        }
    }

    public SyncConfig loadSyncConfigFromString(String yaml) throws IOException {
        SyncConfig config = yamlMapper.readValue(new StringReader(yaml), SyncConfig.class);
        return config != null ? config : new SyncConfig();
    }
}
