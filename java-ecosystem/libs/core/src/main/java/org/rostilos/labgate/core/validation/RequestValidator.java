package org.rostilos.labgate.core.validation;

import org.rostilos.labgate.core.exception.ValidationException;
import org.rostilos.labgate.core.model.item.EItemKind;
import org.rostilos.labgate.core.model.item.ItemQuery;
import org.rostilos.labgate.core.model.permission.ERole;
import org.rostilos.labgate.core.model.permission.PermissionRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates raw caller input for both operations. Every problem found is reported
 * at once in a single {@link ValidationException}; nothing here touches the network.
 */
public final class RequestValidator {

    private static final Pattern FOUR_DIGIT_YEAR = Pattern.compile("\\d{4}");

    private RequestValidator() {
    }

    /**
     * @return the parsed role of a request whose fields are all valid
     * @throws ValidationException listing every invalid field
     */
    public static ERole validatePermission(PermissionRequest request) {
        if (request == null) {
            throw new ValidationException("No permission request provided");
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(request.username())) {
            errors.add("Username cannot be empty");
        }
        if (isBlank(request.target())) {
            errors.add("Target (group/project) cannot be empty");
        }

        Optional<ERole> role = Optional.empty();
        if (isBlank(request.role())) {
            errors.add("Role cannot be empty");
        } else {
            role = ERole.fromName(request.role());
            if (role.isEmpty()) {
                errors.add("Invalid role: " + request.role() + ". Valid roles are: " + ERole.validNames());
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return role.orElseThrow();
    }

    /**
     * @param type item kind as given by the caller, e.g. {@code issues} or {@code mr}
     * @param year calendar year as given by the caller
     * @throws ValidationException listing every invalid parameter
     */
    public static ItemQuery validateItemQuery(String type, String year) {
        List<String> errors = new ArrayList<>();

        Optional<EItemKind> kind = Optional.empty();
        if (isBlank(type)) {
            errors.add("Missing required parameter: type");
        } else {
            kind = EItemKind.fromAlias(type);
            if (kind.isEmpty()) {
                errors.add("Invalid item type: " + type + ". Must be 'issues' or 'mr'");
            }
        }

        int parsedYear = 0;
        if (isBlank(year)) {
            errors.add("Missing required parameter: year");
        } else if (!FOUR_DIGIT_YEAR.matcher(year).matches()) {
            errors.add("Year must be a 4-digit number, got '" + year + "'");
        } else {
            parsedYear = Integer.parseInt(year);
            if (parsedYear < 1) {
                errors.add("Year must be positive, got '" + year + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new ItemQuery(kind.orElseThrow(), parsedYear);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
