package com.example.docxstyle.config;

import com.example.docxstyle.util.style.error.LoggingStyleErrorHandler;
import com.example.docxstyle.util.style.error.StyleErrorHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 样式处理配置
 */
@Configuration
public class StyleConfig {

    // 每次处理前是否加载内置样式库（标题、正文、代码）
    @Value("${docx.style.load-built-ins:true}")
    private boolean loadBuiltIns = true;

    // 请求未指定样式集时使用的样式集名，为空表示不应用
    @Value("${docx.style.default-style-set:}")
    private String defaultStyleSet = "";

    // 请求未上传样式定义时使用的定义文件路径，为空表示必须上传
    @Value("${docx.style.definition-path:}")
    private String definitionPath = "";

    // 是否把注册表中的样式写入输出文档的 styles.xml
    @Value("${docx.style.install-stylesheet:true}")
    private boolean installStyleSheet = true;

    @Bean
    public StyleErrorHandler styleErrorHandler() {
        return new LoggingStyleErrorHandler();
    }

    public boolean isLoadBuiltIns() { return loadBuiltIns; }
    public void setLoadBuiltIns(boolean loadBuiltIns) { this.loadBuiltIns = loadBuiltIns; }

    public String getDefaultStyleSet() { return defaultStyleSet; }
    public void setDefaultStyleSet(String defaultStyleSet) { this.defaultStyleSet = defaultStyleSet; }

    public String getDefinitionPath() { return definitionPath; }
    public void setDefinitionPath(String definitionPath) { this.definitionPath = definitionPath; }

    public boolean isInstallStyleSheet() { return installStyleSheet; }
    public void setInstallStyleSheet(boolean installStyleSheet) { this.installStyleSheet = installStyleSheet; }
}
