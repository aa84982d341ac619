package com.example.almanac.alert;

public enum FireAction {
    NOTIFY, RESTART_AND_NOTIFY
}
