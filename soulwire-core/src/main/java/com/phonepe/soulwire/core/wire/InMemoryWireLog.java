package com.phonepe.soulwire.core.wire;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryWireLog implements WireLog {
    private final List<WireRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(WireRecord record) {
        records.add(record);
    }

    @Override
    public List<WireRecord> records() {
        return List.copyOf(records);
    }
}
