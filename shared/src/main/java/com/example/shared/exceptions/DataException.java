package com.example.shared.exceptions;

/**
 * Ошибка целостности входных данных: битые или немонотонные метки времени,
 * недостаточная история инструмента. Прерывает расчет для затронутых инструментов.
 */
public class DataException extends RuntimeException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
