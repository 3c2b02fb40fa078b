package com.example.docxstyle.service;

import com.example.docxstyle.config.StyleConfig;
import com.example.docxstyle.util.docx.StyleSheetWriter;
import com.example.docxstyle.util.docx.XwpfStyledDocument;
import com.example.docxstyle.util.style.CharacterStyleProperties;
import com.example.docxstyle.util.style.ParagraphStyleProperties;
import com.example.docxstyle.util.style.Style;
import com.example.docxstyle.util.style.StyleManager;
import com.example.docxstyle.util.style.StyleSet;
import com.example.docxstyle.util.style.StyleSheetDefinition;
import com.example.docxstyle.util.style.StyleType;
import com.example.docxstyle.util.style.TableStyleProperties;
import com.example.docxstyle.util.style.XmlStyleParser;
import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;
import com.example.docxstyle.util.style.error.StyleErrorHandler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DOCX 样式处理服务
 *
 * 每次调用创建独立的 StyleManager，请求之间不共享样式注册表
 */
@Slf4j
@Service
public class DocxStyleService {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final StyleConfig styleConfig;
    private final StyleErrorHandler styleErrorHandler;
    private final XmlStyleParser parser = new XmlStyleParser();

    @Autowired
    public DocxStyleService(StyleConfig styleConfig, StyleErrorHandler styleErrorHandler) {
        this.styleConfig = styleConfig;
        this.styleErrorHandler = styleErrorHandler;
    }

    /**
     * 对上传的 DOCX 应用样式定义
     *
     * @param docxStream    DOCX 输入流
     * @param styleSheetXml 样式定义文档，为空时使用配置的默认定义文件
     * @param styleSetName  要应用的样式集，为空时使用配置的默认样式集
     * @param mappingsJson  样式映射 JSON，例如 {"heading1":"CustomHeading"}，可为空
     * @return 处理后的 DOCX 字节
     */
    public byte[] applyStyles(InputStream docxStream, String styleSheetXml, String styleSetName, String mappingsJson)
            throws IOException, StyleProcessingException {
        // 1. 构建样式注册表
        StyleManager manager = buildManager(styleSheetXml);
        Map<String, String> mappings = parseMappings(mappingsJson);
        String setName = isBlank(styleSetName) ? styleConfig.getDefaultStyleSet() : styleSetName;

        try (XWPFDocument document = new XWPFDocument(docxStream)) {
            XwpfStyledDocument styledDocument = new XwpfStyledDocument(document);

            // 2. 应用样式集
            if (!isBlank(setName)) {
                Result<Integer> applied = manager.applyStyleSet(setName, styledDocument);
                check(applied);
                log.info("样式集 {} 已应用到 {} 个元素", setName, applied.getValue());
            }

            // 3. 应用样式映射
            if (!mappings.isEmpty()) {
                Result<Integer> mapped = manager.applyStyleMappings(styledDocument, mappings);
                check(mapped);
                log.info("样式映射已应用到 {} 个元素", mapped.getValue());
            }

            // 4. 写入样式表
            if (styleConfig.isInstallStyleSheet()) {
                StyleSheetWriter.writeStyles(document, manager);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * 解析样式定义并返回概要：样式名、继承解析后的属性、样式集名、生成的 styles.xml
     */
    public Map<String, Object> previewStyles(String styleSheetXml) throws StyleProcessingException {
        StyleManager manager = buildManager(styleSheetXml);

        List<Map<String, Object>> styles = new ArrayList<>();
        for (Style style : manager.getAllStyles()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", style.getName());
            item.put("type", style.getType());
            item.put("builtIn", style.isBuiltIn());
            if (style.hasBaseStyle()) {
                item.put("base", style.getBaseStyle());
            }
            putResolvedProperties(manager, style, item);
            styles.add(item);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("styles", styles);
        result.put("styleSets", manager.listStyleSets());
        result.put("stylesXml", manager.generateStylesXml());
        return result;
    }

    private static void putResolvedProperties(StyleManager manager, Style style, Map<String, Object> item)
            throws StyleProcessingException {
        StyleType type = style.getType();
        if (type == StyleType.PARAGRAPH || type == StyleType.MIXED) {
            ParagraphStyleProperties paragraph = check(manager.resolveParagraphProperties(new ParagraphStyleProperties(), style.getName()));
            if (!paragraph.isEmpty()) {
                item.put("paragraph", paragraph);
            }
        }
        if (type == StyleType.CHARACTER || type == StyleType.MIXED) {
            CharacterStyleProperties character = check(manager.resolveCharacterProperties(new CharacterStyleProperties(), style.getName()));
            if (!character.isEmpty()) {
                item.put("character", character);
            }
        }
        if (type == StyleType.TABLE) {
            TableStyleProperties table = check(manager.resolveTableProperties(new TableStyleProperties(), style.getName()));
            if (!table.isEmpty()) {
                item.put("table", table);
            }
        }
    }

    StyleManager buildManager(String styleSheetXml) throws StyleProcessingException {
        StyleManager manager = new StyleManager(styleErrorHandler);
        if (styleConfig.isLoadBuiltIns()) {
            check(manager.loadAllBuiltInStyles());
        }

        StyleSheetDefinition definition;
        if (!isBlank(styleSheetXml)) {
            definition = check(parser.loadStyleSheetFromString(styleSheetXml));
        } else if (!isBlank(styleConfig.getDefinitionPath())) {
            log.info("使用默认样式定义文件: {}", styleConfig.getDefinitionPath());
            definition = check(parser.loadStyleSheetFromFile(Paths.get(styleConfig.getDefinitionPath())));
        } else {
            definition = new StyleSheetDefinition(Collections.<Style>emptyList(), Collections.<StyleSet>emptyList());
        }

        for (Style style : definition.getStyles()) {
            check(manager.registerStyle(style));
        }
        check(manager.validateAllStyles());
        for (StyleSet set : definition.getStyleSets()) {
            check(manager.registerStyleSet(set));
        }
        log.info("样式注册完成: 样式 {} 个, 样式集 {} 个", manager.styleCount(), manager.listStyleSets().size());
        return manager;
    }

    private static Map<String, String> parseMappings(String mappingsJson) throws StyleProcessingException {
        if (isBlank(mappingsJson)) {
            return Collections.emptyMap();
        }
        try {
            return JSON_MAPPER.readValue(mappingsJson, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (IOException e) {
            throw new StyleProcessingException(StyleError.of(ErrorCode.INVALID_ARGUMENT,
                    "样式映射不是合法的 JSON 对象: " + e.getMessage(), "parse_style_mappings"));
        }
    }

    private static <T> T check(Result<T> result) throws StyleProcessingException {
        if (result.isFailed()) {
            throw new StyleProcessingException(result.getError());
        }
        return result.getValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
