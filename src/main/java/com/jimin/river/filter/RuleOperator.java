package com.jimin.river.filter;

import java.util.Locale;

public enum RuleOperator {
    AND,
    OR;

    /**
     * 알 수 없는 연산자는 AND로 취급한다.
     */
    public static RuleOperator parseOrAnd(String value) {
        if (value != null && "OR".equals(value.trim().toUpperCase(Locale.ROOT))) {
            return OR;
        }
        return AND;
    }
}
