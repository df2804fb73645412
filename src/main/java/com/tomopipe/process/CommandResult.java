package com.tomopipe.process;

public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String describe() {
        if (launchFailed) {
            return "launch failed: " + stderr;
        }
        if (timedOut) {
            return "timed out";
        }
        if (interrupted) {
            return "interrupted";
        }
        return "exitCode=" + exitCode + (stderr.isBlank() ? "" : " stderr=" + stderr);
    }
}
