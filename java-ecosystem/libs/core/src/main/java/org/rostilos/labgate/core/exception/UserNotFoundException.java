package org.rostilos.labgate.core.exception;

public class UserNotFoundException extends LabGateException {

    public static final String ERROR_CODE = "USER_NOT_FOUND";

    private final String username;

    public UserNotFoundException(String username) {
        super("User '" + username + "' not found", ERROR_CODE);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
