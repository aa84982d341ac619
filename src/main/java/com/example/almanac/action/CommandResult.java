package com.example.almanac.action;

import java.time.Duration;

public record CommandResult(int exitCode, String stdout, String stderr, Duration duration) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
