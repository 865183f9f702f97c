package io.fullerstack.ses.core.notify.transport;

/**
 * Raw HTTP outcome of one notification post.
 *
 * @param statusCode HTTP status code
 * @param body       response body, possibly empty
 */
public record TransportResponse(int statusCode, String body) {

    public TransportResponse {
        body = body == null ? "" : body;
    }

    /**
     * @return true for status codes in the 400-500 range, both ends inclusive
     */
    public boolean isFailure() {
        return statusCode >= 400 && statusCode <= 500;
    }
}
