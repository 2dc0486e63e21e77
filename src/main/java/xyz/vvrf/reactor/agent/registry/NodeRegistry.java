package xyz.vvrf.reactor.agent.registry;

import xyz.vvrf.reactor.agent.core.AgentNode;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 节点注册表接口。
 * 负责管理节点类型 ID 到节点实现（或其工厂/原型）的映射，并提供构建期校验所需的元数据。
 * 每个注册表实例关联一个特定的状态类型 S。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public interface NodeRegistry<S> {

    /**
     * 获取此注册表关联的状态类型。
     *
     * @return 状态类型的 Class 对象 (不能为空)。
     */
    Class<S> getStateType();

    /**
     * 注册一个节点实现工厂。每次需要时创建新的节点实例（适用于有状态的节点）。
     *
     * @param nodeTypeId 节点类型的唯一标识符 (在此注册表内唯一, 不能为空)
     * @param factory    创建 AgentNode<S> 实例的 Supplier (不能为空, 不能返回 null)
     * @throws IllegalArgumentException 如果 nodeTypeId 已被注册，或 factory 无效。
     */
    void register(String nodeTypeId, Supplier<? extends AgentNode<S>> factory);

    /**
     * 注册一个节点实现原型（通常是单例）。适用于无状态、线程安全的节点实现。
     *
     * @throws IllegalArgumentException 如果 nodeTypeId 已被注册。
     */
    void register(String nodeTypeId, AgentNode<S> prototype);

    /**
     * 根据节点类型 ID 获取一个节点实例。
     *
     * @return 节点实例的 Optional，未注册时为空。
     */
    Optional<AgentNode<S>> getNodeInstance(String nodeTypeId);

    /**
     * 获取指定节点类型的元信息，用于图构建时的校验。
     */
    Optional<NodeMetadata> getNodeMetadata(String nodeTypeId);

    /**
     * 所有已注册节点类型的元信息。
     */
    Collection<NodeMetadata> getAllNodeMetadata();

    /**
     * 节点元数据，包含节点的静态信息。
     */
    interface NodeMetadata {
        /** 获取节点类型 ID */
        String getTypeId();

        /** 节点实现类 */
        Class<?> getImplementationType();

        /** 节点声明的默认超时，可能为 null */
        Duration getDeclaredTimeout();
    }
}
