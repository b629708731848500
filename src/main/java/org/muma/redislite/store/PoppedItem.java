package org.muma.redislite.store;

/**
 * BLPOP 的结果：从哪个列表弹出了什么值
 */
public record PoppedItem(String list, String value) {
}
