package io.buildbucket.client;

/**
 * Thrown when BuildBucket answers with a non-2xx status. The message is the response body, unmodified.
 */
public class BuildBucketException extends RuntimeException {

    private final int statusCode;

    public BuildBucketException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "BuildBucketException(" + statusCode + "): " + getMessage();
    }
}
