package com.tomopipe.process;

@FunctionalInterface
public interface StageTask {
    void run(StageSession session) throws Exception;
}
