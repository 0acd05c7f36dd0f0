package xyz.vvrf.promptchain.parser;

import org.junit.jupiter.api.Test;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.ChainParseException;
import xyz.vvrf.promptchain.exception.MissingTerminalException;
import xyz.vvrf.promptchain.test.util.TestChains;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainParserTest {

    private final ChainParser parser = new ChainParser();

    @Test
    void parsesDeclarationsInOrderWithReferences() {
        ChainDefinition definition = parser.parse(TestChains.SUMMARY_KEYWORDS);

        assertThat(definition.getChainName()).isEqualTo("prompt-chain");
        assertThat(definition.getNodeNames()).containsExactly("summary", "keywords", "output");
        assertThat(definition.getNode("output").map(PromptNode::getReferences).orElseThrow())
                .containsExactly("summary", "keywords");
        assertThat(definition.getNode("summary").map(PromptNode::getTemplate).orElseThrow())
                .isEqualTo("Summarize: [[input text]]");
    }

    @Test
    void bodyRunsToNextMarkerAndIsTrimmed() {
        String text = "[[a]] =   first line\n  second line\n\n\n[[output]] = [[a]]\n";

        ChainDefinition definition = parser.parse(text);

        assertThat(definition.getNode("a").map(PromptNode::getTemplate).orElseThrow())
                .isEqualTo("first line\n  second line");
    }

    @Test
    void textBeforeFirstMarkerIsIgnored() {
        ChainDefinition definition = parser.parse("Some notes for humans.\n\n[[output]] = hello");

        assertThat(definition.getNodeNames()).containsExactly("output");
        assertThat(definition.getNode("output").map(PromptNode::getTemplate).orElseThrow()).isEqualTo("hello");
    }

    @Test
    void markersMayBeIndentedAndNamesAreTrimmed() {
        ChainDefinition definition = parser.parse("  [[ output ]]\t= x = y");

        assertThat(definition.getNode("output").map(PromptNode::getTemplate).orElseThrow()).isEqualTo("x = y");
    }

    @Test
    void referenceInsideBodyIsNotADeclaration() {
        ChainDefinition definition = parser.parse("[[output]] = Use [[input text]] = the input");

        assertThat(definition.getNodeNames()).containsExactly("output");
        assertThat(definition.getNode("output").orElseThrow().getKind()).isEqualTo(NodeKind.DYNAMIC);
    }

    @Test
    void nodeWithoutReferencesIsStatic() {
        ChainDefinition definition = parser.parse(TestChains.STATIC_STYLE_GUIDE);

        assertThat(definition.getNode("style_guide").orElseThrow().getKind()).isEqualTo(NodeKind.STATIC);
        assertThat(definition.getNode("output").orElseThrow().getKind()).isEqualTo(NodeKind.DYNAMIC);
    }

    @Test
    void textWithoutMarkersIsRejected() {
        assertThatThrownBy(() -> parser.parse("just some text"))
                .isInstanceOf(ChainParseException.class)
                .hasMessageContaining("no node declarations");
    }

    @Test
    void missingOutputIsRejected() {
        assertThatThrownBy(() -> parser.parse(TestChains.NO_OUTPUT))
                .isInstanceOf(MissingTerminalException.class)
                .hasMessageContaining("[[output]]");
    }

    @Test
    void duplicateDeclarationIsRejected() {
        assertThatThrownBy(() -> parser.parse("[[a]] = one\n[[a]] = two\n[[output]] = [[a]]"))
                .isInstanceOf(ChainParseException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    void reservedInputCannotBeDeclared() {
        assertThatThrownBy(() -> parser.parse("[[input text]] = hijack\n[[output]] = [[input text]]"))
                .isInstanceOf(ChainParseException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    void customChainNameIsUsed() {
        assertThat(parser.parse("[[output]] = x", "daily-digest").getChainName()).isEqualTo("daily-digest");
    }
}
