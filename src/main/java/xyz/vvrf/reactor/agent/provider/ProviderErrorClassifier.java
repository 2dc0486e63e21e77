package xyz.vvrf.reactor.agent.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.exception.ProviderFailureException;
import xyz.vvrf.reactor.agent.exception.TransientProviderFailureException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 把提供方调用中出现的任意错误归类为瞬时或永久失败。
 * <ul>
 *     <li>408 / 429 / 5xx / 超时 / 连接错误 -> 瞬时</li>
 *     <li>401 / 403 / 其他 4xx -> 永久</li>
 *     <li>其他无法识别的错误 (例如响应无法解析) -> 永久</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {
        // 工具类不允许实例化
    }

    public static FailureKind classify(Throwable error) {
        if (error instanceof ProviderFailureException) {
            return ((ProviderFailureException) error).getKind();
        }
        if (error instanceof WebClientResponseException) {
            return classifyStatus(((WebClientResponseException) error).getRawStatusCode());
        }
        // 响应体无法解码属于永久失败，必须在 IOException 之前判断
        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return FailureKind.PERMANENT;
        }
        if (error instanceof TimeoutException
                || error instanceof WebClientRequestException
                || error instanceof IOException) {
            return FailureKind.TRANSIENT;
        }
        Throwable cause = error.getCause();
        if (cause != null && cause != error) {
            return classify(cause);
        }
        return FailureKind.PERMANENT;
    }

    public static FailureKind classifyStatus(int status) {
        if (status == 408 || status == 429 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    /**
     * 将错误转换为带分类的 {@link ProviderFailureException}，已经是该类型的原样返回。
     */
    public static ProviderFailureException toFailure(String providerName, Throwable error) {
        if (error instanceof ProviderFailureException) {
            return (ProviderFailureException) error;
        }
        int status = -1;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof WebClientResponseException) {
            WebClientResponseException wcre = (WebClientResponseException) error;
            status = wcre.getRawStatusCode();
            message = wcre.getStatusText();
        } else if (error instanceof TimeoutException) {
            message = "调用超时";
        }
        if (classify(error) == FailureKind.TRANSIENT) {
            return new TransientProviderFailureException(providerName, status, message, error);
        }
        return new PermanentProviderFailureException(providerName, status, message, error);
    }
}
