package xyz.vvrf.reactor.agent.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.AgentNode;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 一个 {@link NodeRegistry} 实现，它会自动发现并注册使用 {@link AgentNodeType} 注解的 Spring Bean。
 * 只注册 {@link AgentNodeType#stateType()} 与本注册表状态类型一致的节点。
 *
 * @param <S> 本注册表管理的状态类型。
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningNodeRegistry<S> implements NodeRegistry<S>, ApplicationContextAware, InitializingBean {

    private final Class<S> stateType;
    private ApplicationContext applicationContext;
    // 内部使用 SimpleNodeRegistry 来存储注册信息和元数据
    private final SimpleNodeRegistry<S> delegateRegistry;

    public SpringScanningNodeRegistry(Class<S> stateType) {
        this.stateType = Objects.requireNonNull(stateType, "状态类型不能为空");
        this.delegateRegistry = new SimpleNodeRegistry<>(stateType);
        log.info("为状态类型 '{}' 创建了 SpringScanningNodeRegistry", stateType.getSimpleName());
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("在 SpringScanningNodeRegistry (状态: " + stateType.getSimpleName() + ") 中 ApplicationContext 未设置");
        }
        log.info("开始为状态 '{}' 扫描 @AgentNodeType Bean...", stateType.getSimpleName());
        scanAndRegisterNodes();
    }

    private void scanAndRegisterNodes() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(AgentNodeType.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            AgentNodeType annotation = applicationContext.findAnnotationOnBean(beanName, AgentNodeType.class);

            if (annotation == null || annotation.stateType() != this.stateType) {
                continue;
            }
            String nodeTypeId = determineNodeTypeId(annotation, beanName);

            if (!(beanInstance instanceof AgentNode)) {
                log.error("Bean '{}' 使用了 @AgentNodeType (状态: '{}') 注解，但未实现 AgentNode 接口。跳过注册。",
                        beanName, stateType.getSimpleName());
                continue;
            }

            try {
                if (BeanDefinition.SCOPE_PROTOTYPE.equals(annotation.scope())) {
                    log.debug("注册原型节点: ID='{}', 状态='{}', Bean名='{}'", nodeTypeId, stateType.getSimpleName(), beanName);
                    Supplier<AgentNode<S>> factory = () -> {
                        Object prototypeBean = applicationContext.getBean(beanName);
                        if (!(prototypeBean instanceof AgentNode)) {
                            throw new IllegalStateException("原型 Bean " + beanName + " 不再是 AgentNode 实例。");
                        }
                        @SuppressWarnings("unchecked")
                        AgentNode<S> node = (AgentNode<S>) prototypeBean;
                        return node;
                    };
                    delegateRegistry.register(nodeTypeId, factory);
                } else {
                    log.debug("注册单例节点: ID='{}', 状态='{}', Bean名='{}'", nodeTypeId, stateType.getSimpleName(), beanName);
                    @SuppressWarnings("unchecked")
                    AgentNode<S> singletonNode = (AgentNode<S>) beanInstance;
                    delegateRegistry.register(nodeTypeId, singletonNode);
                }
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复ID），但继续扫描
                log.error("注册节点 Bean '{}' (ID: '{}', 状态: '{}') 失败: {}",
                        beanName, nodeTypeId, stateType.getSimpleName(), e.getMessage());
            }
        }
        log.info("状态 '{}' 的扫描完成。共注册了 {} 个节点。", stateType.getSimpleName(), registeredCount);
    }

    private String determineNodeTypeId(AgentNodeType annotation, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (id.isEmpty()) {
            log.warn("在 Bean '{}' 的 @AgentNodeType 注解中未提供 'id' 或 'value'。将使用 Bean 名称作为节点类型 ID。", beanName);
            return beanName;
        }
        return id;
    }

    @Override
    public Class<S> getStateType() {
        return delegateRegistry.getStateType();
    }

    @Override
    public void register(String nodeTypeId, Supplier<? extends AgentNode<S>> factory) {
        log.warn("尝试在 SpringScanningNodeRegistry 上手动注册 ID '{}'。推荐使用自动扫描。", nodeTypeId);
        delegateRegistry.register(nodeTypeId, factory);
    }

    @Override
    public void register(String nodeTypeId, AgentNode<S> prototype) {
        log.warn("尝试在 SpringScanningNodeRegistry 上手动注册 ID '{}'。推荐使用自动扫描。", nodeTypeId);
        delegateRegistry.register(nodeTypeId, prototype);
    }

    @Override
    public Optional<AgentNode<S>> getNodeInstance(String nodeTypeId) {
        return delegateRegistry.getNodeInstance(nodeTypeId);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String nodeTypeId) {
        return delegateRegistry.getNodeMetadata(nodeTypeId);
    }

    @Override
    public Collection<NodeMetadata> getAllNodeMetadata() {
        return delegateRegistry.getAllNodeMetadata();
    }
}
