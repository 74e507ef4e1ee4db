package com.eshop.infrastructure.config.database;

import com.p6spy.engine.logging.Category;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy SQL 포매터
 * DDL은 FormatStyle.DDL, 그 외 SQL은 FormatStyle.BASIC으로 정렬합니다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return "";
        }
        return buildLogMessage(format(sql.trim().replaceAll("\\s+", " "), category), elapsed, category);
    }

    private String format(String sql, String category) {
        if (!Category.STATEMENT.getName().equals(category)) {
            return sql;
        }
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }

    private String buildLogMessage(String sql, long elapsed, String category) {
        return "\n[P6Spy] category=" + category + ", elapsed=" + elapsed + "ms" + sql;
    }
}
