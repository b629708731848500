package org.muma.redislite.store;

import org.muma.redislite.common.StreamEntry;

import java.util.List;

/**
 * XREAD 中单个 Stream 的读取结果
 */
public record StreamReadResult(String stream, List<StreamEntry> entries) {
}
