package com.example.docxstyle.util.style.error;

/**
 * 错误观察者，由调用方创建并传给 StyleManager
 */
public interface StyleErrorHandler {

    void onError(StyleError error);
}
