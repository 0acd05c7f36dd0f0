package xyz.vvrf.promptchain.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.ChainNames;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.ChainParseException;
import xyz.vvrf.promptchain.exception.MissingTerminalException;
import xyz.vvrf.promptchain.parser.ReferenceTokenizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建不可变的 ChainDefinition。
 * 引用在 addNode 时由 {@link ReferenceTokenizer} 提取。
 * build() 只检查声明层面的约束 (output 必须存在)；引用和循环的校验由 DependencyGraph 完成。
 *
 * @author Refactored
 */
@Slf4j
public class ChainDefinitionBuilder {

    public static final String DEFAULT_CHAIN_NAME = "prompt-chain";

    private String chainName;
    private final Map<String, PromptNode> nodes = new LinkedHashMap<>();

    public ChainDefinitionBuilder() {
        this(DEFAULT_CHAIN_NAME);
    }

    public ChainDefinitionBuilder(String chainName) {
        this.chainName = Objects.requireNonNull(chainName, "链名称不能为空");
    }

    public ChainDefinitionBuilder name(String name) {
        this.chainName = Objects.requireNonNull(name, "链名称不能为空");
        return this;
    }

    /**
     * 声明一个节点。
     *
     * @throws ChainParseException 名称为空、是保留输入名或已被声明
     */
    public ChainDefinitionBuilder addNode(String name, String template) {
        Objects.requireNonNull(template, "模板不能为 null");
        if (name == null || name.trim().isEmpty()) {
            throw new ChainParseException(String.format("Chain '%s': node declaration with an empty name.", chainName));
        }
        if (ChainNames.isReservedInput(name)) {
            throw new ChainParseException(String.format("Chain '%s': %s is reserved for the initial input and cannot be declared.",
                    chainName, ChainNames.placeholder(name)));
        }
        if (nodes.containsKey(name)) {
            throw new ChainParseException(String.format("Chain '%s': node %s is declared more than once.",
                    chainName, ChainNames.placeholder(name)));
        }
        PromptNode node = new PromptNode(name, template, ReferenceTokenizer.extractReferences(template));
        nodes.put(name, node);
        log.debug("Chain '{}': added node '{}' (kind: {}, references: {})", chainName, name, node.getKind(), node.getReferences());
        return this;
    }

    /**
     * @throws MissingTerminalException 没有声明 output 节点
     */
    public ChainDefinition build() {
        if (!nodes.containsKey(ChainNames.OUTPUT_NODE_NAME)) {
            log.error("Chain '{}' build failed: no output node among {}", chainName, nodes.keySet());
            throw new MissingTerminalException(chainName);
        }
        log.debug("Chain '{}' built with {} node(s): {}", chainName, nodes.size(), nodes.keySet());
        return new DefaultChainDefinition(chainName, nodes);
    }
}
