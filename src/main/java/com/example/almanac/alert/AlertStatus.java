package com.example.almanac.alert;

public enum AlertStatus {
    CLEAR, FIRING
}
