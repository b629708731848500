package org.muma.redislite.store;

/**
 * SET 的写入条件与过期设置
 *
 * @param onlyIfExists    XX
 * @param onlyIfNotExists NX
 * @param ttl             过期设置，null 表示清除旧的 TTL
 */
public record SetOptions(boolean onlyIfExists, boolean onlyIfNotExists, Ttl ttl) {

    public static final SetOptions NONE = new SetOptions(false, false, null);

    public enum TtlKind {
        EX, PX, EXAT, PXAT, KEEPTTL
    }

    /**
     * @param amount EX 为秒，PX 为毫秒，EXAT/PXAT 为 Unix 秒/毫秒时间戳，KEEPTTL 忽略
     */
    public record Ttl(TtlKind kind, long amount) {

        public static final Ttl KEEP = new Ttl(TtlKind.KEEPTTL, 0);

        /**
         * 换算成绝对过期时间 (毫秒)；KEEPTTL 没有自己的时间，返回 -1
         *
         * @throws ArithmeticException 换算结果超出 long 范围
         */
        public long resolveExpireAt(long now) {
            return switch (kind) {
                case EX -> Math.addExact(now, Math.multiplyExact(amount, 1000L));
                case PX -> Math.addExact(now, amount);
                case EXAT -> Math.multiplyExact(amount, 1000L);
                case PXAT -> amount;
                case KEEPTTL -> -1;
            };
        }
    }
}
