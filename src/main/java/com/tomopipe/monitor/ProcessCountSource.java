package com.tomopipe.monitor;

import com.tomopipe.process.ProcessTable;

/**
 * Number of live processes matching whatever the source was built for.
 */
@FunctionalInterface
public interface ProcessCountSource {

    int count();

    static ProcessCountSource matching(ProcessTable table, String pattern) {
        return () -> table.count(pattern);
    }
}
