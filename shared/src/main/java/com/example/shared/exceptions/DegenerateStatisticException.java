package com.example.shared.exceptions;

/**
 * Статистика не определена: нулевая дисперсия ряда или сингулярная матрица регрессии
 */
public class DegenerateStatisticException extends RuntimeException {

    public DegenerateStatisticException(String message) {
        super(message);
    }

    public DegenerateStatisticException(String message, Throwable cause) {
        super(message, cause);
    }
}
