package work.upft.tokens.permutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.upft.tokens.support.TokenTestSupport.doc;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentMergerTest {
    @Test
    void laterTokenValuesWin() {
        var merged = DocumentMerger.merge(doc("c", doc("$value", 1)), doc("c", doc("$value", 2)));
        assertEquals(doc("c", doc("$value", 2)), merged);
    }

    @Test
    void nestedGroupsMerge() {
        var merged = DocumentMerger.merge(doc("g", doc("x", 1)), doc("g", doc("y", 2)));
        assertEquals(doc("g", doc("x", 1, "y", 2)), merged);
    }

    @Test
    void compositeValuesMergeFieldByField() {
        var left = doc("type", doc("$type", "typography", "body", doc("$value", doc("fontSize", "14px", "fontWeight", 400))));
        var right = doc("type", doc("body", doc("$value", doc("fontWeight", 600))));
        var merged = DocumentMerger.merge(left, right);
        assertEquals(
            doc("$type", "typography", "body", doc("$value", doc("fontSize", "14px", "fontWeight", 600))),
            merged.get("type")
        );
    }

    @Test
    void simpleObjectValuesAreReplaced() {
        var left = doc("c", doc("$type", "color", "$value", doc("r", 1, "g", 2)));
        var right = doc("c", doc("$value", doc("r", 9)));
        assertEquals(doc("$type", "color", "$value", doc("r", 9)), DocumentMerger.merge(left, right).get("c"));
    }

    @Test
    void extensionsAreDeepMerged() {
        var left = doc("t", doc("$value", 1, "$extensions", doc("vendor", doc("a", 1))));
        var right = doc("t", doc("$value", 1, "$extensions", doc("vendor", doc("b", 2))));
        assertEquals(doc("vendor", doc("a", 1, "b", 2)), ((Map<?, ?>) DocumentMerger.merge(left, right).get("t")).get("$extensions"));
    }

    @Test
    void conflictingTypesAreRejected() {
        var left = doc("t", doc("$type", "color", "$value", "#fff"));
        var right = doc("t", doc("$type", "dimension", "$value", "4px"));
        var ex = assertThrows(MergeConflictException.class, () -> DocumentMerger.merge(left, right));
        assertEquals("t", ex.path());
    }

    @Test
    void inputsAreNotModified() {
        var left = doc("g", doc("x", doc("$value", List.of(1))));
        var right = doc("g", doc("y", doc("$value", 2)));
        DocumentMerger.merge(left, right);
        assertEquals(doc("g", doc("x", doc("$value", List.of(1)))), left);
        assertEquals(doc("g", doc("y", doc("$value", 2))), right);
    }
}
