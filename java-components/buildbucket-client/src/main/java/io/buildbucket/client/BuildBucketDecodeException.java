package io.buildbucket.client;

/**
 * Thrown when a successful response cannot be turned into the expected type.
 */
public class BuildBucketDecodeException extends RuntimeException {

    private final RpcMethod<?, ?> method;

    public BuildBucketDecodeException(RpcMethod<?, ?> method, String message) {
        super(message);
        this.method = method;
    }

    public BuildBucketDecodeException(RpcMethod<?, ?> method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    /**
     * The method whose response could not be decoded.
     */
    public RpcMethod<?, ?> getMethod() {
        return method;
    }
}
