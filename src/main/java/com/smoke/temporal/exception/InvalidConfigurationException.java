package com.smoke.temporal.exception;

/**
 * 配置错误（如区域数量不是9），生成器不可用
 */
public class InvalidConfigurationException extends TemporalGridException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
