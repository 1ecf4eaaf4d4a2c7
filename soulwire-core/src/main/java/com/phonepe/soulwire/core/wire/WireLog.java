package com.phonepe.soulwire.core.wire;

import java.util.List;

/**
 * Append only store of wire records, read back for replay
 */
public interface WireLog {
    void append(WireRecord record);

    /**
     * All readable records in append order
     */
    List<WireRecord> records();
}
