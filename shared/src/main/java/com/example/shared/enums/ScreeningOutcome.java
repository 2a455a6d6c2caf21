package com.example.shared.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Результат проверки одной пары при скрининге
 */
@Getter
@RequiredArgsConstructor
public enum ScreeningOutcome {
    ACCEPTED("Пара коинтегрирована"),
    INSUFFICIENT_OVERLAP("Недостаточно общих наблюдений, тесты не запускались"),
    LOW_CORRELATION("Корреляция доходностей ниже порога"),
    NOT_COINTEGRATED("Остатки регрессии не стационарны"),
    DEGENERATE("Вырожденная статистика (нулевая дисперсия или сингулярная матрица)"),
    FAILED("Ошибка расчета");

    private final String description;
}
