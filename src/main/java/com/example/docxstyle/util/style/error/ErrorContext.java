package com.example.docxstyle.util.style.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 错误上下文：发生错误的操作名以及附加的键值信息（样式名、属性名等）
 */
public class ErrorContext {

    private final String operation;
    private final Map<String, String> info = new LinkedHashMap<>();

    private ErrorContext(String operation) {
        this.operation = operation;
    }

    public static ErrorContext forOperation(String operation) {
        return new ErrorContext(operation);
    }

    public ErrorContext with(String key, Object value) {
        info.put(key, String.valueOf(value));
        return this;
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, String> getInfo() {
        return Collections.unmodifiableMap(info);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("操作=").append(operation);
        for (Map.Entry<String, String> entry : info.entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
