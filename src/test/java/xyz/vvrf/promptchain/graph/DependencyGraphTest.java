package xyz.vvrf.promptchain.graph;

import org.junit.jupiter.api.Test;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.CycleException;
import xyz.vvrf.promptchain.exception.MissingTerminalException;
import xyz.vvrf.promptchain.exception.UnknownReferenceException;
import xyz.vvrf.promptchain.parser.ChainParser;
import xyz.vvrf.promptchain.test.util.TestChains;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DependencyGraphTest {

    private final ChainParser parser = new ChainParser();

    private DependencyGraph graphOf(String chainText) {
        return DependencyGraph.build(parser.parse(chainText));
    }

    @Test
    void groupsNodesIntoLevelsByDepth() {
        DependencyGraph graph = graphOf(TestChains.SUMMARY_KEYWORDS);

        assertThat(graph.getLevels()).containsExactly(
                Collections.singletonList("input text"),
                Arrays.asList("summary", "keywords"),
                Collections.singletonList("output"));
        assertThat(graph.getDepth("input text")).isZero();
        assertThat(graph.getDepth("summary")).isEqualTo(1);
        assertThat(graph.getDepth("output")).isEqualTo(2);
        assertThat(graph.getDependents("input text")).containsExactly("summary", "keywords");
        assertThat(graph.getDependencies("output")).containsExactly("summary", "keywords");
        assertThat(graph.getDeadNodes()).isEmpty();
    }

    @Test
    void everyNodeIsDeeperThanItsDependencies() {
        DependencyGraph graph = graphOf(
                "[[a]] = [[input text]]\n" +
                "[[b]] = [[a]] [[input text]]\n" +
                "[[c]] = [[b]] [[a]]\n" +
                "[[d]] = static\n" +
                "[[output]] = [[c]] [[d]]\n");

        for (String node : graph.getDepths().keySet()) {
            for (String dep : graph.getDependencies(node)) {
                assertThat(graph.getDepth(node)).as("%s deeper than %s", node, dep).isGreaterThan(graph.getDepth(dep));
            }
            if (graph.getDependencies(node).isEmpty()) {
                assertThat(graph.getDepth(node)).isZero();
            }
        }
        assertThat(graph.getDepth("c")).isEqualTo(3);
        assertThat(graph.getDepth("output")).isEqualTo(4);
    }

    @Test
    void staticNodesLandInLevelZeroAfterInput() {
        DependencyGraph graph = graphOf(TestChains.STATIC_STYLE_GUIDE);

        assertThat(graph.getLevels().get(0)).containsExactly("input text", "style_guide");
        assertThat(graph.getKind("style_guide")).isEqualTo(NodeKind.STATIC);
        assertThat(graph.getKind("input text")).isEqualTo(NodeKind.STATIC);
        assertThat(graph.getKind("output")).isEqualTo(NodeKind.DYNAMIC);
    }

    @Test
    void staticOutputSharesLevelZeroWithInput() {
        DependencyGraph graph = graphOf("[[output]] = plain text");

        assertThat(graph.getLevels()).containsExactly(Arrays.asList("input text", "output"));
    }

    @Test
    void unreferencedNodesAreValidatedButNotScheduled() {
        DependencyGraph graph = graphOf(
                "[[unused]] = notes on [[input text]]\n" +
                "[[output]] = [[input text]]\n");

        assertThat(graph.getDeadNodes()).containsExactly("unused");
        assertThat(graph.getDepth("unused")).isEqualTo(1);
        assertThat(graph.getLevels()).containsExactly(
                Collections.singletonList("input text"),
                Collections.singletonList("output"));
    }

    @Test
    void cycleAmongUnreferencedNodesIsStillRejected() {
        assertThatThrownBy(() -> graphOf("[[x]] = [[y]]\n[[y]] = [[x]]\n[[output]] = hi"))
                .isInstanceOf(CycleException.class);
    }

    @Test
    void cycleReportsClosedPath() {
        CycleException e = catchThrowableOfType(() -> graphOf(TestChains.CYCLE), CycleException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCyclePath()).containsExactly("a", "b", "a");
        assertThat(e.getMessage()).contains("a -> b -> a");
    }

    @Test
    void selfReferenceIsACycle() {
        CycleException e = catchThrowableOfType(() -> graphOf("[[a]] = [[a]]\n[[output]] = [[a]]"), CycleException.class);

        assertThat(e.getCyclePath()).containsExactly("a", "a");
    }

    @Test
    void unknownReferenceIsReportedWithNodeAndName() {
        UnknownReferenceException e = catchThrowableOfType(
                () -> graphOf("[[output]] = [[summary]] of [[input text]]"), UnknownReferenceException.class);

        assertThat(e.getNodeName()).isEqualTo("output");
        assertThat(e.getReference()).isEqualTo("summary");
    }

    @Test
    void programmaticDefinitionWithoutOutputIsRejected() {
        Map<String, PromptNode> nodes = new LinkedHashMap<>();
        nodes.put("a", new PromptNode("a", "x", Collections.emptyList()));
        ChainDefinition definition = new ChainDefinition() {
            @Override
            public String getChainName() {
                return "handmade";
            }

            @Override
            public Map<String, PromptNode> getNodes() {
                return nodes;
            }
        };

        assertThatThrownBy(() -> DependencyGraph.build(definition)).isInstanceOf(MissingTerminalException.class);
    }

    @Test
    void exposesNodesIncludingReservedInput() {
        DependencyGraph graph = graphOf(TestChains.SUMMARY_KEYWORDS);

        assertThat(graph.getNode("input text")).hasValueSatisfying(n -> assertThat(n.isReserved()).isTrue());
        assertThat(graph.getNode("missing")).isEmpty();
        assertThatThrownBy(() -> graph.getDepth("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersDotWithDependencyEdges() {
        DependencyGraph graph = graphOf(TestChains.SUMMARY_KEYWORDS);

        String dot = graph.toDot();

        assertThat(dot).startsWith("digraph \"prompt-chain\" {");
        assertThat(dot).contains("\"input text\" -> \"summary\";");
        assertThat(dot).contains("\"keywords\" -> \"output\";");
    }
}
