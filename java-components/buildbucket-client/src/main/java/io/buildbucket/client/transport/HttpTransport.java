package io.buildbucket.client.transport;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Performs a single HTTP POST and returns the complete response. Timeouts are the transport's concern.
 */
@FunctionalInterface
public interface HttpTransport {

    HttpTransportResponse post(URI uri, Map<String, String> headers, byte[] body) throws IOException;
}
