package org.csits.hrsync.server.service;

import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.server.dto.EnumLabelMap;
import org.springframework.stereotype.Component;

/**
 * 枚举显示名翻译为列表值 ID。未知显示名原样透传，由 HR 平台最终判定。
 */
@Slf4j
@Component
public class ValueTranslator {

    public String translate(String rawValue, EnumLabelMap enumLabels) {
        if (enumLabels == null || rawValue == null) {
            return rawValue;
        }
        return enumLabels.lookup(rawValue).orElseGet(() -> {
            log.debug("列表 {} 中无显示名 '{}'，原样提交", enumLabels.getListName(), rawValue);
            return rawValue;
        });
    }
}
