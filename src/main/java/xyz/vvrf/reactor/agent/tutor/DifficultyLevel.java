package xyz.vvrf.reactor.agent.tutor;

/**
 * 练习难度等级，根据学生表现上下调整。
 *
 * @author ruifeng.wen
 */
public enum DifficultyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    static final double PROMOTE_THRESHOLD = 0.9;
    static final double DEMOTE_THRESHOLD = 0.5;

    /**
     * 得分 >= 0.9 升一级，< 0.5 降一级，其余保持。已在最高或最低级时不变。
     *
     * @param score 表现得分，取值 [0, 1]
     */
    public DifficultyLevel adapt(double score) {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("得分必须在 [0, 1] 之间，实际为: " + score);
        }
        if (score >= PROMOTE_THRESHOLD && this != ADVANCED) {
            return values()[ordinal() + 1];
        }
        if (score < DEMOTE_THRESHOLD && this != BEGINNER) {
            return values()[ordinal() - 1];
        }
        return this;
    }
}
