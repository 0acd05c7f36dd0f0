package xyz.vvrf.promptchain.test.util;

/**
 * 测试中共用的链文本。
 */
public final class TestChains {

    /** summary 和 keywords 都只依赖输入，output 依赖两者。*/
    public static final String SUMMARY_KEYWORDS =
            "[[summary]] = Summarize: [[input text]]\n" +
            "[[keywords]] = Keywords of: [[input text]]\n" +
            "[[output]] = S=[[summary]] K=[[keywords]]\n";

    /** style_guide 没有引用，是 STATIC 节点。*/
    public static final String STATIC_STYLE_GUIDE =
            "[[style_guide]] = Be terse.\n" +
            "[[output]] = Rewrite [[input text]] following [[style_guide]]\n";

    public static final String CYCLE =
            "[[a]] = see [[b]]\n" +
            "[[b]] = see [[a]]\n" +
            "[[output]] = [[a]]\n";

    public static final String NO_OUTPUT =
            "[[summary]] = Summarize: [[input text]]\n";

    private TestChains() {
    }
}
