package com.tomopipe.transfer;

import com.tomopipe.PipelineException;

/**
 * An archive copy that did not complete. Retryable failures are retried with backoff; skip-existing
 * copies make a retry resume rather than restart.
 */
public class TransferException extends PipelineException {
    private final boolean retryable;

    public TransferException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TransferException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
