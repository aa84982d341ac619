package com.example.almanac.action;

import java.util.Map;

public class ActionTimeoutException extends ActionExecutionException {

    public ActionTimeoutException(String message, Map<String, Object> fields) {
        super(message, fields);
    }
}
