package org.muma.redislite.common;

import java.util.List;

/**
 * Stream 中的一条记录
 *
 * @param fields 按插入顺序平铺的 field/value 对: [f1, v1, f2, v2, ...]，允许重复 field
 */
public record StreamEntry(StreamId id, List<String> fields) {

    public StreamEntry {
        if (fields.size() % 2 != 0) {
            throw new IllegalArgumentException("stream fields must come in field/value pairs");
        }
        fields = List.copyOf(fields);
    }
}
