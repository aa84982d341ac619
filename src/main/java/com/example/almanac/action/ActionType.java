package com.example.almanac.action;

public enum ActionType {
    NOTIFY, COMMAND, WEBHOOK
}
