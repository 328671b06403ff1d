package br.com.ferroxide.chatstore.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum StoreErrorCode implements ErrorCode {
    CONSTRAINT_VIOLATION("S001", "Constraint violated: %s"),
    REFERENTIAL_ERROR("S002", "Referenced row does not exist: %s"),
    NOT_FOUND("S003", "%s not found (id: %s)");

    private final String code;
    private final String message;
}
