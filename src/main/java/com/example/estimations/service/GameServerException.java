package com.example.estimations.service;

/** A game server hit an unexpected fault while handling a request and was terminated. */
public class GameServerException extends RuntimeException {

    public GameServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
