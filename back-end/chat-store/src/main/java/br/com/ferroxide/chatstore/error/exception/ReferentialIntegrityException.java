package br.com.ferroxide.chatstore.error.exception;

import br.com.ferroxide.chatstore.error.StoreErrorCode;

/** A foreign key pointed at a row that does not exist. */
public class ReferentialIntegrityException extends StoreException {

    public ReferentialIntegrityException(String detail, Throwable cause) {
        super(StoreErrorCode.REFERENTIAL_ERROR, cause, detail);
    }
}
