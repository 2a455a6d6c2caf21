package com.example.shared.exceptions;

/**
 * Недопустимые значения настроек, обнаруженные при загрузке конфигурации
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
