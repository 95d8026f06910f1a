package org.csits.hrsync.server.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 列表值（枚举项），层级列表已展开。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NamedListValue {

    private String id;

    private String label;
}
