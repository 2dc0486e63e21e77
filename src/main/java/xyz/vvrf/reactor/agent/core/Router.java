package xyz.vvrf.reactor.agent.core;

/**
 * 根据刚完成的节点和其结果选择下一个节点。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public interface Router<S> {

    /**
     * @param nodeId   刚完成的节点实例 ID
     * @param state    节点产出的新状态
     * @param decision 节点的路由决策，可能为 null
     * @return 下一个节点 ID，或 {@link AgentGraph#TERMINAL}
     * @throws xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException 目标不存在时
     */
    String route(String nodeId, S state, Enum<?> decision);
}
