package org.rostilos.labgate.core.model.item;

import com.fasterxml.jackson.annotation.JsonValue;
import org.rostilos.labgate.vcsclient.gitlab.model.EItemType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of items that can be listed, with the spellings accepted from callers.
 */
public enum EItemKind {
    ISSUE("issue", EItemType.ISSUE, List.of("issue", "issues")),
    MERGE_REQUEST("merge_request", EItemType.MERGE_REQUEST, List.of("mr", "mrs", "merge_request", "merge_requests"));

    private final String id;
    private final EItemType itemType;
    private final List<String> aliases;

    EItemKind(String id, EItemType itemType, List<String> aliases) {
        this.id = id;
        this.itemType = itemType;
        this.aliases = aliases;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public EItemType getItemType() {
        return itemType;
    }

    public static Optional<EItemKind> fromAlias(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ENGLISH).replace('-', '_');
        for (EItemKind kind : values()) {
            if (kind.aliases.contains(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
