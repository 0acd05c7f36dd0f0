package xyz.vvrf.promptchain.parser;

import xyz.vvrf.promptchain.core.ChainNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从模板文本中提取 {@code [[name]]} 形式的引用，并执行引用替换。
 * 引用在解析期被提取为类型化列表，替换阶段只依赖该列表，不再扫描未知文本。
 *
 * @author Refactored
 */
public final class ReferenceTokenizer {

    /**
     * 模板正文中的引用。名称按原样保留 (不去除空白)，以便替换时精确匹配占位符。
     */
    static final Pattern REFERENCE_PATTERN = Pattern.compile("\\[\\[([^\\]]+)\\]\\]");

    private ReferenceTokenizer() {}

    /**
     * 按首次出现顺序返回模板中引用的名称，重复项被折叠。
     */
    public static List<String> extractReferences(String template) {
        if (template == null || template.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> references = new LinkedHashSet<>();
        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return Collections.unmodifiableList(new ArrayList<>(references));
    }

    /**
     * 将模板中每个引用的每次出现替换为对应的已解析值。
     * 只扫描一遍原始模板，插入的值不会再被当作引用处理。
     *
     * @param template       原始模板
     * @param references     该模板的引用列表
     * @param resolvedValues 名称 -> 已解析值
     * @return 替换后的文本
     * @throws IllegalStateException 如果某个引用尚无解析值
     */
    public static String substitute(String template, List<String> references, Map<String, String> resolvedValues) {
        for (String reference : references) {
            if (resolvedValues.get(reference) == null) {
                throw new IllegalStateException(String.format(
                        "No resolved value available for dependency %s.", ChainNames.placeholder(reference)));
            }
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        StringBuffer result = new StringBuffer(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = references.contains(name) ? resolvedValues.get(name) : matcher.group();
            // 按字面量替换，值中的 $ 和 \ 不会被解释
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
