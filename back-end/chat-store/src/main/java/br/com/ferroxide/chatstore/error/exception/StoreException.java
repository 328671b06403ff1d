package br.com.ferroxide.chatstore.error.exception;

import br.com.ferroxide.chatstore.error.ErrorCode;
import lombok.Getter;

/**
 * Base of every failure the store reports to its callers. None of them is retried here.
 */
@Getter
public abstract class StoreException extends RuntimeException {
    private final ErrorCode errorCode;

    protected StoreException(ErrorCode errorCode, Object... args) {
        super(String.format(errorCode.getMessage(), args));
        this.errorCode = errorCode;
    }

    protected StoreException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(String.format(errorCode.getMessage(), args), cause);
        this.errorCode = errorCode;
    }
}
