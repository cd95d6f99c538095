package com.peerwarden.api.custody;

import com.peerwarden.api.common.UpstreamFailureException;

/**
 * The key custody store failed to read or write.
 */
public class CustodyStoreException extends UpstreamFailureException {

    public CustodyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
