package br.com.ferroxide.chatstore.error.exception;

import br.com.ferroxide.chatstore.error.StoreErrorCode;
import lombok.Getter;

@Getter
public class NotFoundException extends StoreException {
    private final String entity;
    private final Object id;

    public NotFoundException(String entity, Object id) {
        super(StoreErrorCode.NOT_FOUND, entity, id);
        this.entity = entity;
        this.id = id;
    }
}
