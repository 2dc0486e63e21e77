package xyz.vvrf.reactor.agent.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * 图中节点实例的定义：实例 ID、节点类型 ID 以及可选的实例级超时覆盖。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NodeDefinition {

    private final String instanceId;
    private final String nodeTypeId;
    private final Duration timeoutOverride;

    public NodeDefinition(String instanceId, String nodeTypeId) {
        this(instanceId, nodeTypeId, null);
    }

    public NodeDefinition(String instanceId, String nodeTypeId, Duration timeoutOverride) {
        this.instanceId = Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        this.nodeTypeId = Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        this.timeoutOverride = timeoutOverride;
    }
}
