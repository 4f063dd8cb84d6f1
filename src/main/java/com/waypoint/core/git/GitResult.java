package com.waypoint.core.git;

import java.nio.charset.StandardCharsets;

/**
 * Outcome of one git invocation.
 */
public record GitResult(int exitCode, byte[] stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }
}
