package org.rostilos.labgate.core.model.permission;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EMembershipAction {
    CREATED,
    UPDATED;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
