package com.sitemirror.core.model;

/** 잘못된 시드 URL, 음수 페이지 상한 등. 세션 시작 전에 동기적으로 던진다. */
public class ConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
