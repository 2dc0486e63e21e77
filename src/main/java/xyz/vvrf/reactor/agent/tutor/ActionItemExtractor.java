package xyz.vvrf.reactor.agent.tutor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 从回答中提取可执行的学习建议：包含行动关键词的句子，最多 5 条。
 *
 * @author ruifeng.wen
 */
public final class ActionItemExtractor {

    static final int MAX_ITEMS = 5;

    private static final List<String> KEYWORDS = Collections.unmodifiableList(Arrays.asList(
            "try", "practice", "review", "study", "complete", "solve", "work through", "focus on", "consider"));

    private ActionItemExtractor() {
    }

    public static List<String> extract(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (String sentence : text.split("\\.")) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String lower = trimmed.toLowerCase(Locale.ROOT);
            for (String keyword : KEYWORDS) {
                if (lower.contains(keyword)) {
                    items.add(trimmed + ".");
                    break;
                }
            }
            if (items.size() == MAX_ITEMS) {
                break;
            }
        }
        return items;
    }
}
