package com.typerace.web.common;

import java.io.Serializable;

/**
 * 统一 HTTP 响应格式（各服务的只读查询接口共用）
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 客户端错误（参数错误等）
     * 404: 资源不存在（如房间已解散）
     * 500: 服务器错误
     */
    int code,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应（自定义状态码）
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }
}
