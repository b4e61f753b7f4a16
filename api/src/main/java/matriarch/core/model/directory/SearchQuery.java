package matriarch.core.model.directory;

import java.util.regex.Pattern;

/**
 * A classified identity search.
 *
 * <ul>
 *   <li>{@link Kind#OBJECT_ID}: the text is a GUID and is matched exactly against
 *       object ids, application ids and app registration ids</li>
 *   <li>{@link Kind#EMAIL}: the text contains {@code @} and is matched against user
 *       mail and user principal name</li>
 *   <li>{@link Kind#DISPLAY_NAME}: anything else, matched as a display-name prefix</li>
 * </ul>
 *
 * @param text trimmed search text
 * @param kind how the text is matched
 */
public record SearchQuery(String text, Kind kind) {

    private static final Pattern GUID =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    public enum Kind {
        OBJECT_ID,
        EMAIL,
        DISPLAY_NAME
    }

    public SearchQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Search query cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Search query kind cannot be null");
        }
    }

    public static SearchQuery classify(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query cannot be blank");
        }
        final var text = query.trim();
        if (isGuid(text)) {
            return new SearchQuery(text, Kind.OBJECT_ID);
        }
        if (text.contains("@")) {
            return new SearchQuery(text, Kind.EMAIL);
        }
        return new SearchQuery(text, Kind.DISPLAY_NAME);
    }

    public static boolean isGuid(String value) {
        return value != null && GUID.matcher(value).matches();
    }
}
