package org.muma.redislite.command.impl.list;

import org.muma.redislite.store.StorageEngine;

import java.util.List;

public class LPopCommand extends AbstractPopCommand {

    public LPopCommand() {
        super("lpop");
    }

    @Override
    protected List<String> pop(StorageEngine storage, String key, int count) {
        return storage.lpop(key, count);
    }
}
