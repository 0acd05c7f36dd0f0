package xyz.vvrf.promptchain.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.promptchain.exception.CycleException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GraphUtilsTest {

    @Test
    void diamondDepths() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("top", Arrays.asList("left", "right"));
        deps.put("left", Collections.singletonList("root"));
        deps.put("right", Arrays.asList("root", "left"));
        deps.put("root", Collections.emptyList());

        Map<String, Integer> depths = GraphUtils.computeDepths(deps, "diamond");

        assertThat(depths).containsEntry("root", 0)
                .containsEntry("left", 1)
                .containsEntry("right", 2)
                .containsEntry("top", 3);
        assertThat(depths.keySet()).containsExactly("top", "left", "right", "root");
    }

    @Test
    void deepChainDoesNotOverflow() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        int length = 20_000;
        for (int i = length; i > 0; i--) {
            deps.put("n" + i, Collections.singletonList("n" + (i - 1)));
        }
        deps.put("n0", Collections.emptyList());

        Map<String, Integer> depths = GraphUtils.computeDepths(deps, "long");

        assertThat(depths.get("n" + length)).isEqualTo(length);
    }

    @Test
    void longerCyclePathStartsAtReenteredNode() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("entry", Collections.singletonList("a"));
        deps.put("a", Collections.singletonList("b"));
        deps.put("b", Collections.singletonList("c"));
        deps.put("c", Collections.singletonList("a"));

        CycleException e = catchThrowableOfType(() -> GraphUtils.computeDepths(deps, "loop"), CycleException.class);

        assertThat(e.getCyclePath()).containsExactly("a", "b", "c", "a");
    }

    @Test
    void collectsReachableNodesFromRoot() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("output", Collections.singletonList("a"));
        deps.put("a", Collections.singletonList("input"));
        deps.put("input", Collections.emptyList());
        deps.put("dead", Collections.singletonList("input"));

        assertThat(GraphUtils.collectReachable("output", deps)).containsExactlyInAnyOrder("output", "a", "input");
    }
}
