package com.tomopipe.process;

import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SystemProcessTable implements ProcessTable {
    private static final Logger log = LoggerFactory.getLogger(SystemProcessTable.class);

    @Override
    public int count(String pattern) {
        try (Stream<ProcessHandle> processes = matching(pattern)) {
            return (int) processes.count();
        }
    }

    @Override
    public List<Long> killMatching(String pattern) {
        try (Stream<ProcessHandle> processes = matching(pattern)) {
            return processes
                    .filter(ProcessHandle::destroyForcibly)
                    .map(ProcessHandle::pid)
                    .peek(pid -> log.info("process.killed pid={} pattern={}", pid, pattern))
                    .toList();
        }
    }

    private Stream<ProcessHandle> matching(String pattern) {
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
                .filter(handle -> handle.pid() != self)
                .filter(handle -> handle.info().commandLine()
                        .or(() -> handle.info().command())
                        .map(commandLine -> commandLine.contains(pattern))
                        .orElse(false));
    }
}
