package xyz.vvrf.promptchain.parser;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.builder.ChainDefinitionBuilder;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.exception.ChainParseException;
import xyz.vvrf.promptchain.exception.MissingTerminalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将链文件文本解析为 {@link ChainDefinition}。
 * <p>
 * 声明以行首的 {@code [[name]] =} 标记开始，正文延续到下一个标记或文本末尾。
 * 正文首尾空白被去除，内部格式原样保留。解析只提取引用，不做依赖解析。
 *
 * @author Refactored
 */
@Slf4j
public class ChainParser {

    /**
     * 声明标记：行首 (允许前导空格/制表符) 的 {@code [[name]]}，后跟 {@code =}。
     */
    static final Pattern DECLARATION_PATTERN = Pattern.compile("^[ \\t]*\\[\\[([^\\]\\n]*)\\]\\][ \\t]*=", Pattern.MULTILINE);

    /**
     * 使用默认链名称解析。
     */
    public ChainDefinition parse(String chainText) {
        return parse(chainText, ChainDefinitionBuilder.DEFAULT_CHAIN_NAME);
    }

    /**
     * 解析链文件文本。
     *
     * @param chainText 完整的链文件内容
     * @param chainName 用于日志和错误信息的链名称
     * @return 不可变的链定义
     * @throws ChainParseException      格式错误或重复声明
     * @throws MissingTerminalException 缺少 output 节点
     */
    public ChainDefinition parse(String chainText, String chainName) {
        Objects.requireNonNull(chainText, "链文本不能为 null");
        Objects.requireNonNull(chainName, "链名称不能为空");

        List<int[]> markers = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Matcher matcher = DECLARATION_PATTERN.matcher(chainText);
        while (matcher.find()) {
            // [标记起始, 正文起始]
            markers.add(new int[]{matcher.start(), matcher.end()});
            names.add(matcher.group(1).trim());
        }

        if (markers.isEmpty()) {
            throw new ChainParseException(String.format(
                    "Chain '%s': no node declarations found. Expected lines of the form '[[name]] = text'.", chainName));
        }

        String preamble = chainText.substring(0, markers.get(0)[0]).trim();
        if (!preamble.isEmpty()) {
            log.debug("Chain '{}': ignoring {} character(s) of text before the first declaration.", chainName, preamble.length());
        }

        ChainDefinitionBuilder builder = new ChainDefinitionBuilder(chainName);
        for (int i = 0; i < markers.size(); i++) {
            int bodyStart = markers.get(i)[1];
            int bodyEnd = (i + 1 < markers.size()) ? markers.get(i + 1)[0] : chainText.length();
            String body = chainText.substring(bodyStart, bodyEnd).trim();
            builder.addNode(names.get(i), body);
        }

        ChainDefinition definition = builder.build();
        log.debug("Chain '{}': parsed {} node declaration(s): {}", chainName, definition.getNodes().size(), definition.getNodeNames());
        return definition;
    }
}
