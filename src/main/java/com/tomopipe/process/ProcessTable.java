package com.tomopipe.process;

import java.util.List;

/**
 * View of the host process table, matched by substring of the full command line.
 */
public interface ProcessTable {

    int count(String pattern);

    /**
     * Forcibly terminates every process whose command line contains {@code pattern}, excluding
     * the current JVM.
     *
     * @return pids that were signalled
     */
    List<Long> killMatching(String pattern);
}
