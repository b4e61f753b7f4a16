package matriarch.core.model.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SearchQuery")
class SearchQueryTest {

    @Test
    @DisplayName("should classify a GUID as an object id")
    void shouldClassifyGuid() {
        var query = SearchQuery.classify(" 6F9619FF-8B86-D011-B42D-00C04FC964FF ");

        assertEquals(SearchQuery.Kind.OBJECT_ID, query.kind());
        assertEquals("6F9619FF-8B86-D011-B42D-00C04FC964FF", query.text());
    }

    @Test
    @DisplayName("should classify text containing @ as an email")
    void shouldClassifyEmail() {
        assertEquals(SearchQuery.Kind.EMAIL, SearchQuery.classify("ada@example.com").kind());
    }

    @Test
    @DisplayName("should classify anything else as a display name")
    void shouldClassifyDisplayName() {
        var query = SearchQuery.classify("Billing Service");

        assertEquals(SearchQuery.Kind.DISPLAY_NAME, query.kind());
        assertEquals("Billing Service", query.text());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\t"})
    @DisplayName("should reject blank queries")
    void shouldRejectBlank(String query) {
        assertThrows(IllegalArgumentException.class, () -> SearchQuery.classify(query));
    }

    @Test
    @DisplayName("should recognise GUIDs only in canonical form")
    void shouldRecogniseGuids() {
        assertTrue(SearchQuery.isGuid("00000000-0000-0000-0000-000000000000"));
        assertFalse(SearchQuery.isGuid("00000000000000000000000000000000"));
        assertFalse(SearchQuery.isGuid("not-a-guid"));
        assertFalse(SearchQuery.isGuid(null));
    }
}
