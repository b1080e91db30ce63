package com.resilia.neurogrid.common.exception;

import com.resilia.neurogrid.common.web.result.ApiResult;
import com.resilia.neurogrid.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理电网控制异常
     */
    @ExceptionHandler(GridException.class)
    public ResponseEntity<ApiResult<?>> handleGridException(GridException e, HttpServletRequest request) {
        if (e.getKind().isTransientCondition()) {
            log.warn("控制异常 - Kind: {}, Subject: {}, {}", e.getKind(), e.getSubject(), e.getMessage());
        } else {
            log.error("控制异常 - Kind: {}, Subject: {}, {}", e.getKind(), e.getSubject(), e.getMessage());
        }
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("kind", e.getKind().name());
        result.addExtra("subject", e.getSubject());
        return ResponseEntity.status(httpStatusOf(e.getKind())).body(result);
    }

    private HttpStatus httpStatusOf(GridErrorKind kind) {
        switch (kind) {
            case INVALID_TELEMETRY:
                return HttpStatus.BAD_REQUEST;
            case INVALID_OPERATION:
                return HttpStatus.CONFLICT;
            case SENSOR_STALE:
            case PEER_UNREACHABLE:
            case COMMUNICATION_LOSS:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResult<?> handleMethodArgumentNotValidException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理请求体解析异常
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResult<?> handleNotReadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("请求体无法解析: {} {}", request.getMethod(), request.getRequestURI());
        return ApiResult.error(ResultCode.BAD_REQUEST.getCode(), "请求体格式错误");
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), ResultCode.SYSTEM_ERROR.getMessage());
    }
}
