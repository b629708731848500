package org.muma.redislite.replication;

/**
 * 节点角色，启动时确定，之后不再变化
 */
public enum ReplRole {
    MASTER("master"),
    REPLICA("slave");

    private final String infoName;

    ReplRole(String infoName) {
        this.infoName = infoName;
    }

    /**
     * INFO replication 中 role 字段的取值
     */
    public String infoName() {
        return infoName;
    }
}
