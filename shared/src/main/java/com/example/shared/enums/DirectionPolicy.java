package com.example.shared.enums;

/**
 * Какие направления регрессии (A на B, B на A) оставлять для пары
 */
public enum DirectionPolicy {
    /**
     * Оба направления тестируются, остается направление с меньшим p-value
     */
    BEST,
    /**
     * Оба направления попадают в результат отдельными кандидатами
     */
    BOTH,
    /**
     * Только A < B по имени инструмента, регрессия A на B
     */
    LEXICOGRAPHIC
}
