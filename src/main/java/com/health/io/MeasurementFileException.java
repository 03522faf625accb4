package com.health.io;

/**
 * 测量文件读取异常
 */
public class MeasurementFileException extends RuntimeException {

    public MeasurementFileException(String message) {
        super(message);
    }

    public MeasurementFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
