package com.example.shared.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExitReasonType {
    EXIT_REASON_BY_Z_EXIT("Выход по возврату Z к уровню выхода"),
    EXIT_REASON_END_OF_DATA("Принудительное закрытие на последнем баре");

    private final String description;
}
