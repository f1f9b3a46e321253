package org.rostilos.labgate.core.exception;

/**
 * The target path is neither a group nor a project visible to the service token.
 */
public class TargetNotFoundException extends LabGateException {

    public static final String ERROR_CODE = "TARGET_NOT_FOUND";

    private final String target;

    public TargetNotFoundException(String target) {
        super("Target '" + target + "' not found as a group or project", ERROR_CODE);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
