package com.example.docxstyle.util.style.error;

import java.util.function.Function;

/**
 * 操作结果：成功时携带值，失败时携带 {@link StyleError}
 *
 * @param <T> 成功值类型，无返回值的操作使用 {@link Void}
 */
public final class Result<T> {

    private static final Result<Void> OK = new Result<>(null, null);

    private final T value;
    private final StyleError error;

    private Result(T value, StyleError error) {
        this.value = value;
        this.error = error;
    }

    public static Result<Void> ok() {
        return OK;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> fail(StyleError error) {
        if (error == null) {
            throw new IllegalArgumentException("失败结果必须携带错误");
        }
        return new Result<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * 取成功值
     *
     * @throws IllegalStateException 结果为失败时
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("结果为失败，无法取值: " + error);
        }
        return value;
    }

    public StyleError getError() {
        return error;
    }

    public T orElse(T other) {
        return error == null ? value : other;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return fail(error);
        }
        return ok(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) {
            return fail(error);
        }
        return mapper.apply(value);
    }

    /**
     * 把失败结果转换为另一种值类型，成功结果调用此方法属于编程错误
     */
    public <U> Result<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("只有失败结果可以传播");
        }
        return fail(error);
    }

    @Override
    public String toString() {
        return error == null ? "Result.ok(" + value + ")" : "Result.fail(" + error + ")";
    }
}
