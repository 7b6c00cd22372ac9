package io.buildbucket.client.transport;

import java.nio.charset.StandardCharsets;

public record HttpTransportResponse(int statusCode, byte[] body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}
