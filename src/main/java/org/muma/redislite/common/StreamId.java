package org.muma.redislite.common;

import org.muma.redislite.exception.StreamIdException;

/**
 * Stream 条目 ID: <毫秒时间>-<序号>，按 (time, sequence) 字典序比较。
 * 两个分量都是非负 long。
 */
public record StreamId(long time, long sequence) implements Comparable<StreamId> {

    public static final StreamId MIN = new StreamId(0, 0);
    public static final StreamId MAX = new StreamId(Long.MAX_VALUE, Long.MAX_VALUE);

    public StreamId {
        if (time < 0 || sequence < 0) {
            throw new StreamIdException(StreamIdException.INVALID);
        }
    }

    /**
     * 解析 "T-S" 或 "T"；没有序号时用 defaultSequence 补齐
     */
    public static StreamId parse(String text, long defaultSequence) {
        try {
            int dash = text.indexOf('-');
            if (dash < 0) {
                return new StreamId(Long.parseLong(text), defaultSequence);
            }
            return new StreamId(Long.parseLong(text.substring(0, dash)), Long.parseLong(text.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new StreamIdException(StreamIdException.INVALID);
        }
    }

    public boolean isZero() {
        return time == 0 && sequence == 0;
    }

    @Override
    public int compareTo(StreamId other) {
        int c = Long.compare(time, other.time);
        return c != 0 ? c : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return time + "-" + sequence;
    }
}
