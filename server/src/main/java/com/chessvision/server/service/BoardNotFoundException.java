package com.chessvision.server.service;

/**
 * No board could be located in a photo and no region was supplied by the caller.
 */
public class BoardNotFoundException extends RuntimeException {

    public BoardNotFoundException(String message) {
        super(message);
    }
}
