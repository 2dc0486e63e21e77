package xyz.vvrf.reactor.agent.exception;

/**
 * 运行的步数超过上限。图允许环路，步数上限防止无限循环。
 *
 * @author ruifeng.wen
 */
public class StepLimitExceededException extends AgentException {

    public StepLimitExceededException(String graphName, int maxSteps, String nodeId) {
        super(String.format("图 '%s' 的运行超过最大步数 %d (准备执行节点 '%s')", graphName, maxSteps, nodeId));
    }
}
