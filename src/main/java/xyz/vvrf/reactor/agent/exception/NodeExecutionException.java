package xyz.vvrf.reactor.agent.exception;

import lombok.Getter;

/**
 * 节点执行失败。包装节点抛出的原始错误并记录节点 ID。
 *
 * @author ruifeng.wen
 */
@Getter
public class NodeExecutionException extends AgentException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message) {
        super(String.format("节点 '%s' 执行失败: %s", nodeId, message));
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, Throwable cause) {
        super(String.format("节点 '%s' 执行失败: %s", nodeId,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        this.nodeId = nodeId;
    }
}
