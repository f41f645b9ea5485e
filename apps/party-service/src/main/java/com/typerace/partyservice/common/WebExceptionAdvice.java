package com.typerace.partyservice.common;

import com.typerace.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器（HTTP 查询接口）。
 */
@RestControllerAdvice
public class WebExceptionAdvice {
    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 该异常通常出现在 Controller 层的参数校验失败时。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }
}
