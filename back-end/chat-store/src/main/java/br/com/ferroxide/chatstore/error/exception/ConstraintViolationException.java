package br.com.ferroxide.chatstore.error.exception;

import br.com.ferroxide.chatstore.error.StoreErrorCode;

/** Uniqueness, primary-key or check collision. */
public class ConstraintViolationException extends StoreException {

    public ConstraintViolationException(String detail, Throwable cause) {
        super(StoreErrorCode.CONSTRAINT_VIOLATION, cause, detail);
    }
}
