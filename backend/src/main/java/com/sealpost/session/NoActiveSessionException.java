package com.sealpost.session;

public class NoActiveSessionException extends RuntimeException {

    public NoActiveSessionException() {
        super("No user is logged in");
    }
}
