package xyz.vvrf.reactor.agent.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 事件流开始之前的错误映射为 HTTP 400。流开始之后的错误由运行自己的 error/done 帧表达。
 *
 * @author ruifeng.wen
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException e) {
        List<String> details = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.debug("请求校验失败: {}", details);
        return badRequest("请求参数校验失败", details);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException e) {
        log.debug("请求体无法解析: {}", e.getReason());
        return badRequest(e.getReason() != null ? e.getReason() : "请求体无法解析", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("非法请求参数: {}", e.getMessage());
        return badRequest(e.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.BAD_REQUEST.value());
        body.put("error", message);
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return ResponseEntity.badRequest().body(body);
    }
}
