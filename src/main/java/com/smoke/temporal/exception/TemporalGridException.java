package com.smoke.temporal.exception;

/**
 * 时序网格生成相关异常的基类
 */
public class TemporalGridException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemporalGridException(String message) {
        super(message);
    }

    public TemporalGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
