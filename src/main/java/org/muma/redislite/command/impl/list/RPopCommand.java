package org.muma.redislite.command.impl.list;

import org.muma.redislite.store.StorageEngine;

import java.util.List;

public class RPopCommand extends AbstractPopCommand {

    public RPopCommand() {
        super("rpop");
    }

    @Override
    protected List<String> pop(StorageEngine storage, String key, int count) {
        return storage.rpop(key, count);
    }
}
