package com.example.almanac.outbox;

import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Maps an HTTP answer from a chat API to a delivery result: 2xx delivered, 429 and 5xx retryable,
 * any other status permanent.
 */
final class HttpStatusMapping {

    private HttpStatusMapping() {
    }

    static void check(String api, Response response) throws IOException {
        if (response.isSuccessful()) return;
        int code = response.code();
        ResponseBody body = response.body();
        String detail = body != null ? body.string() : "";
        if (detail.length() > 500) {
            detail = detail.substring(0, 500);
        }
        String message = api + " answered HTTP " + code + (detail.isEmpty() ? "" : ": " + detail);
        boolean retryable = code == 429 || code >= 500;
        throw new DeliveryException(message, !retryable);
    }
}
