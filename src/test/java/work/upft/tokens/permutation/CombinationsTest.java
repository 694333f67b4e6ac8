package work.upft.tokens.permutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.upft.tokens.support.TokenTestSupport.doc;

import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class CombinationsTest {
    @Test
    void powerSetStartsEmpty() {
        assertEquals(
            List.of(List.of(), List.of("a"), List.of("b"), List.of("a", "b")),
            Combinations.powerSet(List.of("a", "b"))
        );
    }

    @Test
    void cartesianVariesLastAxisFastest() {
        var axes = new LinkedHashMap<String, List<Object>>();
        axes.put("theme", List.of("light", "dark"));
        axes.put("density", List.of("compact", "cozy"));
        assertEquals(List.of(
            doc("theme", "light", "density", "compact"),
            doc("theme", "light", "density", "cozy"),
            doc("theme", "dark", "density", "compact"),
            doc("theme", "dark", "density", "cozy")
        ), Combinations.cartesian(axes));
    }
}
