package xyz.vvrf.reactor.agent.annotation;

import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个类为可被发现的 Agent 节点实现。
 * 使用此注解的类如果其 {@link #stateType()} 与注册表的状态类型匹配，
 * 将会被 {@link xyz.vvrf.reactor.agent.registry.SpringScanningNodeRegistry} 自动注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface AgentNodeType {

    /**
     * 节点类型 ID，{@link #id()} 的别名。
     */
    @AliasFor("id")
    String value() default "";

    /**
     * 节点类型 ID，{@link #value()} 的别名。
     */
    @AliasFor("value")
    String id() default "";

    /**
     * 此节点实现所操作的状态类。
     */
    Class<?> stateType();

    /**
     * 此节点的 Spring bean 定义的作用域。
     */
    String scope() default BeanDefinition.SCOPE_SINGLETON;
}
