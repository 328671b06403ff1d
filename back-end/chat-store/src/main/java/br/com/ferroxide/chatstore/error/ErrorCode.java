package br.com.ferroxide.chatstore.error;

public interface ErrorCode {
    String getCode();
    String getMessage();
}
