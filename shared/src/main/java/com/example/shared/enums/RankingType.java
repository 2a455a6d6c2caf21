package com.example.shared.enums;

public enum RankingType {
    CORRELATION,
    P_VALUE
}
