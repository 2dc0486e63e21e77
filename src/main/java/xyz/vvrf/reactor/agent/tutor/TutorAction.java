package xyz.vvrf.reactor.agent.tutor;

import java.util.Locale;

/**
 * 客户端显式请求的动作。除 GENERAL 外，显式动作跳过意图分析的模型调用。
 *
 * @author ruifeng.wen
 */
public enum TutorAction {
    GENERAL("general", Intent.GENERAL),
    EXPLAIN_CONCEPT("explain_concept", Intent.EXPLAIN),
    CHECK_UNDERSTANDING("check_understanding", Intent.PRACTICE),
    CREATE_PLAN("create_plan", Intent.STUDY_PLAN);

    private final String wireName;
    private final Intent intent;

    TutorAction(String wireName, Intent intent) {
        this.wireName = wireName;
        this.intent = intent;
    }

    public String getWireName() {
        return wireName;
    }

    public Intent toIntent() {
        return intent;
    }

    /**
     * @throws IllegalArgumentException 未知动作
     */
    public static TutorAction fromWire(String value) {
        if (value == null || value.trim().isEmpty()) {
            return GENERAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("practice".equals(normalized)) {
            return CHECK_UNDERSTANDING;
        }
        for (TutorAction action : values()) {
            if (action.wireName.equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("未知的动作: " + value);
    }
}
