package xyz.vvrf.reactor.agent.registry;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.AgentNode;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * NodeRegistry 的简单内存实现。
 * 线程安全。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleNodeRegistry<S> implements NodeRegistry<S> {

    private final Class<S> stateType;
    // 存储节点工厂或原型包装成的工厂
    private final Map<String, Supplier<? extends AgentNode<S>>> factoryMap = new ConcurrentHashMap<>();
    private final Map<String, NodeMetadata> metadataMap = new ConcurrentHashMap<>();

    public SimpleNodeRegistry(Class<S> stateType) {
        this.stateType = Objects.requireNonNull(stateType, "状态类型不能为空");
        log.info("SimpleNodeRegistry 已创建，关联状态类型: {}", stateType.getSimpleName());
    }

    @Override
    public Class<S> getStateType() {
        return stateType;
    }

    @Override
    public void register(String nodeTypeId, Supplier<? extends AgentNode<S>> factory) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        Objects.requireNonNull(factory, "节点工厂不能为空");

        if (factoryMap.putIfAbsent(nodeTypeId, factory) != null) {
            throw new IllegalArgumentException(String.format("节点类型 ID '%s' 在状态 '%s' 的注册表中已存在。",
                    nodeTypeId, stateType.getSimpleName()));
        }

        // 预先获取一次实例以提取元数据并进行校验
        AgentNode<S> sampleInstance;
        try {
            sampleInstance = factory.get();
        } catch (Exception e) {
            factoryMap.remove(nodeTypeId);
            log.error("从工厂获取节点类型 '{}' 的示例实例失败。", nodeTypeId, e);
            throw new IllegalArgumentException("无法从工厂实例化节点以提取元数据: " + nodeTypeId, e);
        }
        if (sampleInstance == null) {
            factoryMap.remove(nodeTypeId);
            throw new IllegalArgumentException(String.format("节点类型 '%s' 的工厂返回了 null 实例。", nodeTypeId));
        }
        metadataMap.put(nodeTypeId, metadataOf(nodeTypeId, sampleInstance));

        log.info("状态 '{}': 已注册节点类型 '{}' (使用工厂, 实现: {})",
                stateType.getSimpleName(), nodeTypeId, sampleInstance.getClass().getName());
    }

    @Override
    public void register(String nodeTypeId, AgentNode<S> prototype) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        Objects.requireNonNull(prototype, "节点原型不能为空");

        Supplier<AgentNode<S>> factory = () -> prototype;
        if (factoryMap.putIfAbsent(nodeTypeId, factory) != null) {
            throw new IllegalArgumentException(String.format("节点类型 ID '%s' 在状态 '%s' 的注册表中已存在。",
                    nodeTypeId, stateType.getSimpleName()));
        }
        metadataMap.put(nodeTypeId, metadataOf(nodeTypeId, prototype));

        log.info("状态 '{}': 已注册节点类型 '{}' (使用原型, 实现: {})",
                stateType.getSimpleName(), nodeTypeId, prototype.getClass().getName());
    }

    @Override
    public Optional<AgentNode<S>> getNodeInstance(String nodeTypeId) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        Supplier<? extends AgentNode<S>> factory = factoryMap.get(nodeTypeId);
        return Optional.ofNullable(factory).map(Supplier::get);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String nodeTypeId) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        return Optional.ofNullable(metadataMap.get(nodeTypeId));
    }

    @Override
    public Collection<NodeMetadata> getAllNodeMetadata() {
        return Collections.unmodifiableCollection(metadataMap.values());
    }

    private NodeMetadata metadataOf(String nodeTypeId, AgentNode<S> instance) {
        return new SimpleNodeMetadata(nodeTypeId, instance.getClass(), instance.getExecutionTimeout());
    }

    @Value
    static class SimpleNodeMetadata implements NodeMetadata {
        String typeId;
        Class<?> implementationType;
        Duration declaredTimeout;
    }
}
