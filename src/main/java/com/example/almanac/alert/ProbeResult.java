package com.example.almanac.alert;

public record ProbeResult(boolean ok, String detail) {

    public static ProbeResult ok(String detail) {
        return new ProbeResult(true, detail);
    }

    public static ProbeResult failed(String detail) {
        return new ProbeResult(false, detail);
    }
}
