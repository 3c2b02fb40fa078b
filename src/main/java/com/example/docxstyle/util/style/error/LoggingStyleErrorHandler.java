package com.example.docxstyle.util.style.error;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认错误处理：写 warn 日志
 */
@Slf4j
public class LoggingStyleErrorHandler implements StyleErrorHandler {

    @Override
    public void onError(StyleError error) {
        log.warn("样式操作失败: {}", error);
    }
}
