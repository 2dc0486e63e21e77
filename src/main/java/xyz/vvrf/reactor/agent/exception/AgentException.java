package xyz.vvrf.reactor.agent.exception;

/**
 * 编排引擎异常的公共基类 (非受检)。
 *
 * @author ruifeng.wen
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
