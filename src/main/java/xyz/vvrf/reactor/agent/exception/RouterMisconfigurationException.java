package xyz.vvrf.reactor.agent.exception;

/**
 * 图的路由配置错误：缺少默认边、目标节点不存在、节点类型未注册等。
 * 属于致命错误，不会重试；构建期发现时从 build() 抛出。
 *
 * @author ruifeng.wen
 */
public class RouterMisconfigurationException extends IllegalStateException {

    public RouterMisconfigurationException(String message) {
        super(message);
    }
}
