package com.smoke.temporal.exception;

/**
 * 输入结构错误：帧序列无法作为3通道8位图像处理
 */
public class InvalidInputException extends TemporalGridException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
