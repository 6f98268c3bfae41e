package com.rvoc.user;

public class LoginFailedException extends RuntimeException {

    public enum Reason {
        INVALID_USERNAME_OR_PASSWORD,
        RATE_LIMIT_REACHED
    }

    private final Reason reason;

    public LoginFailedException(Reason reason) {
        super(switch (reason) {
            case INVALID_USERNAME_OR_PASSWORD -> "Invalid username or password";
            case RATE_LIMIT_REACHED -> "Too many login attempts, try again later";
        });
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
