package com.example.shared.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Состояние позиции по паре в стратегии
 */
@Getter
@RequiredArgsConstructor
public enum PositionState {
    FLAT("Нет позиции"),
    LONG_SPREAD("Лонг спреда: покупаем A, продаем B"),
    SHORT_SPREAD("Шорт спреда: продаем A, покупаем B");

    private final String description;

    public boolean isOpen() {
        return this != FLAT;
    }
}
