package com.example.shared.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SlippageMode {
    /**
     * Каждое исполнение платит полный спред bid/ask сверх котировки (пессимистичная модель)
     */
    FULL_SPREAD("Полный спред bid/ask"),
    /**
     * Расширение: фиксированное число тиков заданного размера
     */
    TICK("Проскальзывание в тиках");

    private final String description;
}
