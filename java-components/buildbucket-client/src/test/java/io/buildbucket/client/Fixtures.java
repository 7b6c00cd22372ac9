package io.buildbucket.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;

final class Fixtures {

    private Fixtures() {
    }

    static String load(String name) {
        try {
            return IOUtils.resourceToString("/fixtures/" + name, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * A fixture as the service would send it, preamble included.
     */
    static String response(String name) {
        return BuildBucketClient.RPC_RESPONSE_PREAMBLE + "\n" + load(name);
    }
}
