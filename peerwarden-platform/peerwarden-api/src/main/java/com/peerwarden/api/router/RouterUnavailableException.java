package com.peerwarden.api.router;

import com.peerwarden.api.common.UpstreamFailureException;

/**
 * The router could not be reached or rejected the request.
 */
public class RouterUnavailableException extends UpstreamFailureException {

    public RouterUnavailableException(String message) {
        super(message);
    }

    public RouterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
