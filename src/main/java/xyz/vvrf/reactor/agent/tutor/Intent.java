package xyz.vvrf.reactor.agent.tutor;

import java.util.Locale;

/**
 * 意图分析节点的分类结果，同时也是它的路由决策。
 *
 * @author ruifeng.wen
 */
public enum Intent {
    EXPLAIN,
    EXPLAIN_AND_PRACTICE,
    PRACTICE,
    STUDY_PLAN,
    GENERAL;

    public boolean wantsPractice() {
        return this == EXPLAIN_AND_PRACTICE || this == PRACTICE;
    }

    /**
     * 需要学习材料作为依据的意图。
     */
    public boolean usesContent() {
        return this == EXPLAIN || this == EXPLAIN_AND_PRACTICE || this == PRACTICE;
    }

    /**
     * 解析模型返回的标签，无法识别时返回 GENERAL。
     */
    public static Intent fromLabel(String label) {
        if (label == null) {
            return GENERAL;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        // 模型偶尔会在标签后面加解释，取第一行
        int newline = normalized.indexOf('\n');
        if (newline >= 0) {
            normalized = normalized.substring(0, newline);
        }
        normalized = normalized.trim().replace('-', '_').replace(' ', '_').replaceAll("[^A-Z_]", "");
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return GENERAL;
    }
}
