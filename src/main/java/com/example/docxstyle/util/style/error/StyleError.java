package com.example.docxstyle.util.style.error;

/**
 * 样式子系统的结构化错误
 *
 * <p>错误不可变；{@link #causedBy(StyleError)} 返回带有原因链的新实例，
 * 用于批量操作把第一个失败挂到汇总错误之下。</p>
 */
public class StyleError {

    private final ErrorCode code;
    private final String message;
    private final ErrorContext context;
    private final StyleError cause;

    public StyleError(ErrorCode code, String message, ErrorContext context) {
        this(code, message, context, null);
    }

    private StyleError(ErrorCode code, String message, ErrorContext context, StyleError cause) {
        if (code == null) {
            throw new IllegalArgumentException("错误码不能为空");
        }
        this.code = code;
        this.message = message;
        this.context = context;
        this.cause = cause;
    }

    public static StyleError of(ErrorCode code, String message, String operation) {
        return new StyleError(code, message, ErrorContext.forOperation(operation));
    }

    public static StyleError styleNotFound(String styleName, String operation) {
        return new StyleError(ErrorCode.STYLE_NOT_FOUND, "样式不存在: " + styleName,
                ErrorContext.forOperation(operation).with("style", styleName));
    }

    public StyleError causedBy(StyleError cause) {
        return new StyleError(code, message, context, cause);
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ErrorContext getContext() {
        return context;
    }

    public StyleError getCause() {
        return cause;
    }

    /**
     * 沿原因链找到最底层的错误，没有原因时返回自身
     */
    public StyleError getRootCause() {
        StyleError current = this;
        while (current.cause != null) {
            current = current.cause;
        }
        return current;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(getCategory()).append('/').append(code).append("] ").append(message);
        if (context != null) {
            sb.append(" (").append(context).append(')');
        }
        if (cause != null) {
            sb.append("\n  原因: ").append(cause);
        }
        return sb.toString();
    }
}
