package com.example.docxstyle.util.style;

import com.example.docxstyle.util.docx.element.ParagraphElement;
import com.example.docxstyle.util.docx.element.RunElement;
import com.example.docxstyle.util.docx.element.StyledDocument;
import com.example.docxstyle.util.docx.element.StyledElement;
import com.example.docxstyle.util.docx.element.StyledElementVisitor;
import com.example.docxstyle.util.docx.element.TableElement;
import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.ErrorContext;
import com.example.docxstyle.util.style.error.LoggingStyleErrorHandler;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;
import com.example.docxstyle.util.style.error.StyleErrorHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 样式管理器
 *
 * <p>持有样式注册表和样式集，负责内置样式库加载、继承解析、样式应用、提取与比较。
 * 所有公开操作返回 {@link Result}，失败同时通知构造时传入的 {@link StyleErrorHandler}。</p>
 *
 * <p>非线程安全：一个实例只能在单个线程内使用。</p>
 */
@Slf4j
public class StyleManager {

    private static final Map<BuiltInStyleCategory, List<String>> BUILT_IN_NAMES = new EnumMap<>(BuiltInStyleCategory.class);

    static {
        BUILT_IN_NAMES.put(BuiltInStyleCategory.HEADING, Collections.unmodifiableList(Arrays.asList(
                "Heading 1", "Heading 2", "Heading 3", "Heading 4", "Heading 5", "Heading 6")));
        BUILT_IN_NAMES.put(BuiltInStyleCategory.BODY_TEXT, Collections.singletonList("Normal"));
        BUILT_IN_NAMES.put(BuiltInStyleCategory.LIST, Collections.<String>emptyList());
        BUILT_IN_NAMES.put(BuiltInStyleCategory.TABLE, Collections.<String>emptyList());
        BUILT_IN_NAMES.put(BuiltInStyleCategory.TECHNICAL, Collections.singletonList("Code"));
    }

    private final Map<String, Style> styles = new TreeMap<>();
    private final Map<String, StyleSet> styleSets = new LinkedHashMap<>();
    private final Set<BuiltInStyleCategory> loadedCategories = EnumSet.noneOf(BuiltInStyleCategory.class);
    private final StyleErrorHandler errorHandler;

    public StyleManager() {
        this(new LoggingStyleErrorHandler());
    }

    public StyleManager(StyleErrorHandler errorHandler) {
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    private <T> Result<T> report(Result<T> result) {
        if (result.isFailed()) {
            errorHandler.onError(result.getError());
        }
        return result;
    }

    // ==================== 注册表 ====================

    public Result<Style> createStyle(String name, StyleType type) {
        return report(doCreateStyle(name, type));
    }

    public Result<Style> createParagraphStyle(String name) {
        return createStyle(name, StyleType.PARAGRAPH);
    }

    public Result<Style> createCharacterStyle(String name) {
        return createStyle(name, StyleType.CHARACTER);
    }

    public Result<Style> createTableStyle(String name) {
        return createStyle(name, StyleType.TABLE);
    }

    public Result<Style> createMixedStyle(String name) {
        return createStyle(name, StyleType.MIXED);
    }

    /**
     * 注册外部构建的样式（例如定义文档解析结果），注册前做完整校验
     */
    public Result<Style> registerStyle(Style style) {
        return report(doRegisterStyle(style));
    }

    private Result<Style> doCreateStyle(String name, StyleType type) {
        if (type == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "样式类型不能为空", "create_style"));
        }
        Result<Void> nameCheck = checkNewName(name, "create_style");
        if (nameCheck.isFailed()) {
            return nameCheck.propagate();
        }
        Style style = new Style(name, type);
        styles.put(name, style);
        log.debug("创建样式: {} ({})", name, type);
        return Result.ok(style);
    }

    private Result<Style> doRegisterStyle(Style style) {
        if (style == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "样式不能为空", "register_style"));
        }
        Result<Void> nameCheck = checkNewName(style.getName(), "register_style");
        if (nameCheck.isFailed()) {
            return nameCheck.propagate();
        }
        Result<Void> valid = style.validate();
        if (valid.isFailed()) {
            return valid.propagate();
        }
        styles.put(style.getName(), style);
        log.debug("注册样式: {}", style);
        return Result.ok(style);
    }

    private Result<Void> checkNewName(String name, String op) {
        if (name == null || name.isEmpty()) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "样式名不能为空", op));
        }
        if (name.length() > Style.MAX_NAME_LENGTH) {
            return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT,
                    "样式名超过" + Style.MAX_NAME_LENGTH + "个字符",
                    ErrorContext.forOperation(op).with("length", name.length())));
        }
        if (styles.containsKey(name)) {
            return Result.fail(new StyleError(ErrorCode.STYLE_ALREADY_EXISTS, "样式已存在: " + name,
                    ErrorContext.forOperation(op).with("style", name)));
        }
        return Result.ok();
    }

    /**
     * 查找样式，返回注册表中的实例；样式被删除或注册表被清空后该实例不再受管理
     */
    public Result<Style> getStyle(String name) {
        return report(lookup(name, "get_style"));
    }

    private Result<Style> lookup(String name, String op) {
        Style style = name == null ? null : styles.get(name);
        if (style == null) {
            return Result.fail(StyleError.styleNotFound(name, op));
        }
        return Result.ok(style);
    }

    public boolean hasStyle(String name) {
        return name != null && styles.containsKey(name);
    }

    /**
     * 删除样式；仍被其他样式作为基础样式引用时拒绝删除
     */
    public Result<Void> removeStyle(String name) {
        String op = "remove_style";
        if (!hasStyle(name)) {
            return report(Result.<Void>fail(StyleError.styleNotFound(name, op)));
        }
        for (Style other : styles.values()) {
            if (name.equals(other.getBaseStyle())) {
                return report(Result.<Void>fail(new StyleError(ErrorCode.STYLE_DEPENDENCY_MISSING,
                        "样式 " + other.getName() + " 继承自 " + name + "，不能删除",
                        ErrorContext.forOperation(op).with("style", name).with("dependent", other.getName()))));
            }
        }
        styles.remove(name);
        log.debug("删除样式: {}", name);
        return Result.ok();
    }

    public int styleCount() {
        return styles.size();
    }

    public List<String> getAllStyleNames() {
        return new ArrayList<>(styles.keySet());
    }

    public List<String> getStyleNamesByType(StyleType type) {
        List<String> names = new ArrayList<>();
        for (Style style : styles.values()) {
            if (style.getType() == type) {
                names.add(style.getName());
            }
        }
        return names;
    }

    /**
     * 清空全部样式以及内置分类加载记录；样式集保留
     */
    public void clearAllStyles() {
        styles.clear();
        loadedCategories.clear();
        log.debug("已清空样式注册表");
    }

    /**
     * 校验所有样式：属性范围、基础样式存在性、继承环
     */
    public Result<Void> validateAllStyles() {
        String op = "validate_all_styles";
        for (Style style : styles.values()) {
            StyleError failure = null;
            Result<Void> valid = style.validate();
            if (valid.isFailed()) {
                failure = valid.getError();
            } else if (style.hasBaseStyle() && !styles.containsKey(style.getBaseStyle())) {
                failure = new StyleError(ErrorCode.STYLE_DEPENDENCY_MISSING,
                        "基础样式不存在: " + style.getBaseStyle(),
                        ErrorContext.forOperation(op).with("style", style.getName()));
            } else {
                Result<Void> chain = checkInheritanceChain(style.getName(), op);
                if (chain.isFailed()) {
                    failure = chain.getError();
                }
            }
            if (failure != null) {
                return report(Result.<Void>fail(new StyleError(ErrorCode.VALIDATION_FAILED,
                        "样式校验失败: " + style.getName(),
                        ErrorContext.forOperation(op).with("style", style.getName())).causedBy(failure)));
            }
        }
        return Result.ok();
    }

    private Result<Void> checkInheritanceChain(String name, String op) {
        Set<String> visited = new HashSet<>();
        Style current = styles.get(name);
        while (current != null) {
            if (!visited.add(current.getName())) {
                return Result.fail(new StyleError(ErrorCode.STYLE_INHERITANCE_CYCLE,
                        "检测到样式继承环: " + current.getName(),
                        ErrorContext.forOperation(op).with("style", name)));
            }
            current = current.hasBaseStyle() ? styles.get(current.getBaseStyle()) : null;
        }
        return Result.ok();
    }

    // ==================== 内置样式库 ====================

    /**
     * 加载一个内置样式分类，重复加载不做任何事。名称冲突时整个分类加载失败，注册表不变
     */
    public Result<Void> loadBuiltInStyles(BuiltInStyleCategory category) {
        if (loadedCategories.contains(category)) {
            return Result.ok();
        }
        String op = "load_built_in_styles";
        for (String name : BUILT_IN_NAMES.get(category)) {
            if (styles.containsKey(name)) {
                return report(Result.<Void>fail(new StyleError(ErrorCode.STYLE_ALREADY_EXISTS,
                        "内置样式与已有样式重名: " + name,
                        ErrorContext.forOperation(op).with("category", category).with("style", name))));
            }
        }

        List<Style> built = new ArrayList<>();
        switch (category) {
            case HEADING:
                for (int level = 1; level <= 6; level++) {
                    Style heading = new Style("Heading " + level, StyleType.MIXED);
                    Result<Void> result = firstFailure(
                            heading.setFont("Calibri", 16 - 2 * (level - 1)),
                            heading.setAlignment(Alignment.LEFT),
                            heading.setSpacing(12, 6));
                    if (result.isOk()) {
                        CharacterStyleProperties chars = heading.getCharacterProperties();
                        chars.setFormattingFlags(FormattingFlag.BOLD.mask());
                        result = heading.setCharacterProperties(chars);
                    }
                    if (result.isFailed()) {
                        return report(result);
                    }
                    built.add(heading);
                }
                break;
            case BODY_TEXT:
                Style normal = new Style("Normal", StyleType.MIXED);
                // 只设置段后间距，段前保持未设置
                ParagraphStyleProperties normalParagraph = new ParagraphStyleProperties();
                normalParagraph.setAlignment(Alignment.LEFT);
                normalParagraph.setSpaceAfterPts(6.0);
                Result<Void> normalResult = firstFailure(
                        normal.setFont("Calibri", 11),
                        normal.setParagraphProperties(normalParagraph));
                if (normalResult.isFailed()) {
                    return report(normalResult);
                }
                built.add(normal);
                break;
            case TECHNICAL:
                Style code = new Style("Code", StyleType.CHARACTER);
                Result<Void> codeResult = firstFailure(code.setFont("Consolas", 10), code.setColor("333333"));
                if (codeResult.isFailed()) {
                    return report(codeResult);
                }
                built.add(code);
                break;
            default:
                // LIST 与 TABLE 暂无内置样式
                break;
        }

        for (Style style : built) {
            style.markBuiltIn();
            styles.put(style.getName(), style);
        }
        loadedCategories.add(category);
        log.info("加载内置样式分类: {}, 新增样式 {} 个", category, built.size());
        return Result.ok();
    }

    public Result<Void> loadAllBuiltInStyles() {
        for (BuiltInStyleCategory category : BuiltInStyleCategory.values()) {
            Result<Void> result = loadBuiltInStyles(category);
            if (result.isFailed()) {
                return result;
            }
        }
        return Result.ok();
    }

    public boolean isCategoryLoaded(BuiltInStyleCategory category) {
        return loadedCategories.contains(category);
    }

    public List<String> getBuiltInStyleNames(BuiltInStyleCategory category) {
        return BUILT_IN_NAMES.get(category);
    }

    @SafeVarargs
    private static Result<Void> firstFailure(Result<Void>... results) {
        for (Result<Void> result : results) {
            if (result.isFailed()) {
                return result;
            }
        }
        return Result.ok();
    }

    // ==================== 继承解析 ====================

    /**
     * 三种属性包的复制、取自身属性、覆盖操作
     */
    private interface PropertyAccess<P> {
        P copy(P props);

        P own(Style style);

        P overlay(P target, P overlay);
    }

    private static final PropertyAccess<ParagraphStyleProperties> PARAGRAPH_ACCESS = new PropertyAccess<ParagraphStyleProperties>() {
        @Override
        public ParagraphStyleProperties copy(ParagraphStyleProperties props) {
            return new ParagraphStyleProperties(props);
        }

        @Override
        public ParagraphStyleProperties own(Style style) {
            return style.getParagraphProperties();
        }

        @Override
        public ParagraphStyleProperties overlay(ParagraphStyleProperties target, ParagraphStyleProperties overlay) {
            return target.overlay(overlay);
        }
    };

    private static final PropertyAccess<CharacterStyleProperties> CHARACTER_ACCESS = new PropertyAccess<CharacterStyleProperties>() {
        @Override
        public CharacterStyleProperties copy(CharacterStyleProperties props) {
            return new CharacterStyleProperties(props);
        }

        @Override
        public CharacterStyleProperties own(Style style) {
            return style.getCharacterProperties();
        }

        @Override
        public CharacterStyleProperties overlay(CharacterStyleProperties target, CharacterStyleProperties overlay) {
            return target.overlay(overlay);
        }
    };

    private static final PropertyAccess<TableStyleProperties> TABLE_ACCESS = new PropertyAccess<TableStyleProperties>() {
        @Override
        public TableStyleProperties copy(TableStyleProperties props) {
            return new TableStyleProperties(props);
        }

        @Override
        public TableStyleProperties own(Style style) {
            return style.getTableProperties();
        }

        @Override
        public TableStyleProperties overlay(TableStyleProperties target, TableStyleProperties overlay) {
            return target.overlay(overlay);
        }
    };

    /**
     * 以 start 为起点沿继承链解析段落属性；样式自身已设置的字段优先于基础样式和 start
     */
    public Result<ParagraphStyleProperties> resolveParagraphProperties(ParagraphStyleProperties start, String styleName) {
        return report(resolve(orEmpty(start, new ParagraphStyleProperties()), styleName, PARAGRAPH_ACCESS, new HashSet<String>()));
    }

    public Result<CharacterStyleProperties> resolveCharacterProperties(CharacterStyleProperties start, String styleName) {
        return report(resolve(orEmpty(start, new CharacterStyleProperties()), styleName, CHARACTER_ACCESS, new HashSet<String>()));
    }

    public Result<TableStyleProperties> resolveTableProperties(TableStyleProperties start, String styleName) {
        return report(resolve(orEmpty(start, new TableStyleProperties()), styleName, TABLE_ACCESS, new HashSet<String>()));
    }

    private static <P> P orEmpty(P value, P empty) {
        return value != null ? value : empty;
    }

    private <P> Result<P> resolve(P start, String styleName, PropertyAccess<P> access, Set<String> visited) {
        Style style = styleName == null ? null : styles.get(styleName);
        if (style == null) {
            return Result.ok(access.copy(start));
        }
        if (!visited.add(styleName)) {
            return Result.fail(new StyleError(ErrorCode.STYLE_INHERITANCE_CYCLE,
                    "检测到样式继承环: " + styleName,
                    ErrorContext.forOperation("resolve_inheritance").with("style", styleName).with("chain", visited)));
        }

        P own = access.own(style);
        if (!style.hasBaseStyle()) {
            return Result.ok(access.overlay(access.copy(start), own));
        }
        Result<P> base = resolve(start, style.getBaseStyle(), access, visited);
        if (base.isFailed()) {
            return base;
        }
        return Result.ok(access.overlay(base.getValue(), own));
    }

    // ==================== 读取元素属性 ====================

    public Result<ParagraphStyleProperties> readParagraphProperties(ParagraphElement paragraph) {
        return report(doReadParagraph(paragraph));
    }

    public Result<CharacterStyleProperties> readCharacterProperties(RunElement run) {
        return report(doReadCharacter(run));
    }

    public Result<TableStyleProperties> readTableProperties(TableElement table) {
        return report(doReadTable(table));
    }

    private Result<ParagraphStyleProperties> doReadParagraph(ParagraphElement paragraph) {
        if (paragraph == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "段落不能为空", "read_paragraph_properties"));
        }
        try {
            ParagraphStyleProperties props = new ParagraphStyleProperties();
            props.setAlignment(paragraph.getAlignment());
            props.setSpaceBeforePts(paragraph.getSpaceBefore());
            props.setSpaceAfterPts(paragraph.getSpaceAfter());
            props.setLineSpacing(paragraph.getLineSpacing());
            props.setLeftIndentPts(paragraph.getLeftIndent());
            props.setRightIndentPts(paragraph.getRightIndent());
            props.setFirstLineIndentPts(paragraph.getFirstLineIndent());
            props.setListType(paragraph.getListType());
            props.setListLevel(paragraph.getListLevel());
            return Result.ok(props);
        } catch (RuntimeException e) {
            return elementFailure("read_paragraph_properties", e);
        }
    }

    private Result<CharacterStyleProperties> doReadCharacter(RunElement run) {
        if (run == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "文本片段不能为空", "read_character_properties"));
        }
        try {
            CharacterStyleProperties props = new CharacterStyleProperties();
            props.setFontName(run.getFontName());
            props.setFontSizePts(run.getFontSize());
            props.setFontColorHex(run.getColor());
            props.setHighlightColor(run.getHighlight());
            int flags = run.getFormattingFlags();
            props.setFormattingFlags(flags == 0 ? null : flags);
            return Result.ok(props);
        } catch (RuntimeException e) {
            return elementFailure("read_character_properties", e);
        }
    }

    private Result<TableStyleProperties> doReadTable(TableElement table) {
        if (table == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "表格不能为空", "read_table_properties"));
        }
        try {
            TableStyleProperties props = new TableStyleProperties();
            props.setBorderStyle(table.getBorderStyle());
            props.setBorderWidthPts(table.getBorderWidth());
            props.setBorderColorHex(table.getBorderColor());
            props.setCellPaddingPts(table.getCellMargin());
            props.setTableWidthPts(table.getWidth());
            props.setTableAlignment(table.getAlignment());
            return Result.ok(props);
        } catch (RuntimeException e) {
            return elementFailure("read_table_properties", e);
        }
    }

    // ==================== 有效属性 ====================

    /**
     * 段落直接属性经所引用样式的继承链解析后的结果
     */
    public Result<ParagraphStyleProperties> getEffectiveParagraphProperties(ParagraphElement paragraph) {
        Result<ParagraphStyleProperties> direct = doReadParagraph(paragraph);
        if (direct.isFailed()) {
            return report(direct);
        }
        return effective(direct.getValue(), paragraph, PARAGRAPH_ACCESS);
    }

    public Result<CharacterStyleProperties> getEffectiveCharacterProperties(RunElement run) {
        Result<CharacterStyleProperties> direct = doReadCharacter(run);
        if (direct.isFailed()) {
            return report(direct);
        }
        return effective(direct.getValue(), run, CHARACTER_ACCESS);
    }

    public Result<TableStyleProperties> getEffectiveTableProperties(TableElement table) {
        Result<TableStyleProperties> direct = doReadTable(table);
        if (direct.isFailed()) {
            return report(direct);
        }
        return effective(direct.getValue(), table, TABLE_ACCESS);
    }

    private <P> Result<P> effective(P direct, StyledElement element, PropertyAccess<P> access) {
        String styleName;
        try {
            styleName = element.getStyleName();
        } catch (RuntimeException e) {
            return report(this.<P>elementFailure("get_effective_properties", e));
        }
        if (styleName == null) {
            return Result.ok(direct);
        }
        return report(resolve(direct, styleName, access, new HashSet<String>()));
    }

    // ==================== 应用属性 ====================

    /**
     * 只写入已指定的字段，其余保持不变
     */
    public Result<Void> applyParagraphProperties(ParagraphElement paragraph, ParagraphStyleProperties props) {
        return report(doApplyParagraphProperties(paragraph, props));
    }

    public Result<Void> applyCharacterProperties(RunElement run, CharacterStyleProperties props) {
        return report(doApplyCharacterProperties(run, props));
    }

    public Result<Void> applyTableProperties(TableElement table, TableStyleProperties props) {
        return report(doApplyTableProperties(table, props));
    }

    private Result<Void> doApplyParagraphProperties(ParagraphElement paragraph, ParagraphStyleProperties props) {
        String op = "apply_paragraph_properties";
        if (paragraph == null || props == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "段落和属性不能为空", op));
        }
        try {
            if (props.getAlignment() != null) paragraph.setAlignment(props.getAlignment());
            if (props.getSpaceBeforePts() != null) paragraph.setSpaceBefore(props.getSpaceBeforePts());
            if (props.getSpaceAfterPts() != null) paragraph.setSpaceAfter(props.getSpaceAfterPts());
            if (props.getLineSpacing() != null) paragraph.setLineSpacing(props.getLineSpacing());
            if (props.getLeftIndentPts() != null) paragraph.setLeftIndent(props.getLeftIndentPts());
            if (props.getRightIndentPts() != null) paragraph.setRightIndent(props.getRightIndentPts());
            if (props.getFirstLineIndentPts() != null) paragraph.setFirstLineIndent(props.getFirstLineIndentPts());
            if (props.getListType() != null) {
                paragraph.setListStyle(props.getListType(), props.getListLevel() != null ? props.getListLevel() : 0);
            }
            return Result.ok();
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
    }

    private Result<Void> doApplyCharacterProperties(RunElement run, CharacterStyleProperties props) {
        String op = "apply_character_properties";
        if (run == null || props == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "文本片段和属性不能为空", op));
        }
        try {
            if (props.getFontName() != null) run.setFontName(props.getFontName());
            if (props.getFontSizePts() != null) run.setFontSize(props.getFontSizePts());
            if (props.getFontColorHex() != null) run.setColor(props.getFontColorHex());
            if (props.getHighlightColor() != null) run.setHighlight(props.getHighlightColor());
            if (props.getFormattingFlags() != null) run.setFormattingFlags(props.getFormattingFlags());
            return Result.ok();
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
    }

    private Result<Void> doApplyTableProperties(TableElement table, TableStyleProperties props) {
        String op = "apply_table_properties";
        if (table == null || props == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "表格和属性不能为空", op));
        }
        try {
            if (props.getBorderStyle() != null) table.setBorderStyle(props.getBorderStyle());
            if (props.getBorderWidthPts() != null) table.setBorderWidth(props.getBorderWidthPts());
            if (props.getBorderColorHex() != null) table.setBorderColor(props.getBorderColorHex());
            if (props.getCellPaddingPts() != null) table.setCellMargins(props.getCellPaddingPts());
            if (props.getTableWidthPts() != null) table.setWidth(props.getTableWidthPts());
            if (props.getTableAlignment() != null) table.setAlignment(props.getTableAlignment());
            return Result.ok();
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
    }

    // ==================== 应用样式 ====================

    public Result<Void> applyParagraphStyle(ParagraphElement paragraph, String styleName) {
        return report(doApplyParagraphStyle(paragraph, styleName));
    }

    public Result<Void> applyCharacterStyle(RunElement run, String styleName) {
        return report(doApplyCharacterStyle(run, styleName));
    }

    public Result<Void> applyTableStyle(TableElement table, String styleName) {
        return report(doApplyTableStyle(table, styleName));
    }

    /**
     * 按元素种类分派到对应的样式应用操作
     */
    public Result<Void> applyStyle(StyledElement element, final String styleName) {
        if (element == null) {
            return report(Result.<Void>fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "元素不能为空", "apply_style")));
        }
        return report(element.accept(new StyledElementVisitor<Result<Void>>() {
            @Override
            public Result<Void> visitParagraph(ParagraphElement paragraph) {
                return doApplyParagraphStyle(paragraph, styleName);
            }

            @Override
            public Result<Void> visitRun(RunElement run) {
                return doApplyCharacterStyle(run, styleName);
            }

            @Override
            public Result<Void> visitTable(TableElement table) {
                return doApplyTableStyle(table, styleName);
            }
        }));
    }

    private Result<Void> doApplyParagraphStyle(ParagraphElement paragraph, String styleName) {
        String op = "apply_paragraph_style";
        Result<Style> found = lookup(styleName, op);
        if (found.isFailed()) {
            return found.propagate();
        }
        Style style = found.getValue();
        StyleType type = style.getType();
        if (type != StyleType.PARAGRAPH && type != StyleType.MIXED && type != StyleType.NUMBERING) {
            return typeMismatch(style, "段落", op);
        }
        try {
            paragraph.setStyleName(styleName);
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
        if (type.allowsParagraphProperties()) {
            return doApplyParagraphProperties(paragraph, style.getParagraphProperties());
        }
        return Result.ok();
    }

    private Result<Void> doApplyCharacterStyle(RunElement run, String styleName) {
        String op = "apply_character_style";
        Result<Style> found = lookup(styleName, op);
        if (found.isFailed()) {
            return found.propagate();
        }
        Style style = found.getValue();
        if (!style.getType().allowsCharacterProperties()) {
            return typeMismatch(style, "文本片段", op);
        }
        try {
            run.setStyleName(styleName);
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
        return doApplyCharacterProperties(run, style.getCharacterProperties());
    }

    private Result<Void> doApplyTableStyle(TableElement table, String styleName) {
        String op = "apply_table_style";
        Result<Style> found = lookup(styleName, op);
        if (found.isFailed()) {
            return found.propagate();
        }
        Style style = found.getValue();
        if (!style.getType().allowsTableProperties()) {
            return typeMismatch(style, "表格", op);
        }
        try {
            table.setStyleName(styleName);
        } catch (RuntimeException e) {
            return elementFailure(op, e);
        }
        return doApplyTableProperties(table, style.getTableProperties());
    }

    private static Result<Void> typeMismatch(Style style, String target, String op) {
        return Result.fail(new StyleError(ErrorCode.STYLE_PROPERTY_INVALID,
                style.getType() + " 类型的样式不能应用到" + target + ": " + style.getName(),
                ErrorContext.forOperation(op).with("style", style.getName()).with("type", style.getType())));
    }

    private <T> Result<T> elementFailure(String op, RuntimeException e) {
        return Result.fail(new StyleError(ErrorCode.ELEMENT_OPERATION_FAILED,
                "文档元素操作失败: " + e.getMessage(),
                ErrorContext.forOperation(op).with("exception", e.getClass().getSimpleName())));
    }

    // ==================== 样式集 ====================

    public Result<Void> registerStyleSet(StyleSet styleSet) {
        String op = "register_style_set";
        if (styleSet == null || styleSet.getName() == null || styleSet.getName().isEmpty()) {
            return report(Result.<Void>fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "样式集名不能为空", op)));
        }
        if (styleSets.containsKey(styleSet.getName())) {
            return report(Result.<Void>fail(new StyleError(ErrorCode.STYLE_ALREADY_EXISTS,
                    "样式集已存在: " + styleSet.getName(),
                    ErrorContext.forOperation(op).with("style_set", styleSet.getName()))));
        }
        for (String styleName : styleSet.getIncludedStyles()) {
            if (!styles.containsKey(styleName)) {
                return report(Result.<Void>fail(new StyleError(ErrorCode.STYLE_NOT_FOUND,
                        "样式集引用了不存在的样式: " + styleName,
                        ErrorContext.forOperation(op).with("style_set", styleSet.getName()).with("style", styleName))));
            }
        }
        styleSets.put(styleSet.getName(), new StyleSet(styleSet));
        log.debug("注册样式集: {}", styleSet);
        return Result.ok();
    }

    public boolean hasStyleSet(String name) {
        return name != null && styleSets.containsKey(name);
    }

    /**
     * @return 样式集副本
     */
    public Result<StyleSet> getStyleSet(String name) {
        StyleSet set = name == null ? null : styleSets.get(name);
        if (set == null) {
            return report(Result.<StyleSet>fail(styleSetNotFound(name, "get_style_set")));
        }
        return Result.ok(new StyleSet(set));
    }

    public List<String> listStyleSets() {
        return new ArrayList<>(styleSets.keySet());
    }

    public Result<Void> removeStyleSet(String name) {
        if (!hasStyleSet(name)) {
            return report(Result.<Void>fail(styleSetNotFound(name, "remove_style_set")));
        }
        styleSets.remove(name);
        return Result.ok();
    }

    private static StyleError styleSetNotFound(String name, String op) {
        return new StyleError(ErrorCode.STYLE_NOT_FOUND, "样式集不存在: " + name,
                ErrorContext.forOperation(op).with("style_set", name));
    }

    /**
     * 按 表格 → 段落 → 文本片段 的优先级应用样式集
     *
     * <ol>
     *   <li>集合中的每个表格样式应用到所有表格</li>
     *   <li>没有样式的段落应用集合中第一个段落类样式</li>
     *   <li>没有样式的文本片段应用集合中第一个字符样式</li>
     * </ol>
     * 引用的样式在应用前必须全部存在；单个元素失败不影响其余元素，最后汇总报告。
     *
     * @return 成功设置样式的元素个数
     */
    public Result<Integer> applyStyleSet(String setName, StyledDocument document) {
        String op = "apply_style_set";
        StyleSet set = setName == null ? null : styleSets.get(setName);
        if (set == null) {
            return report(Result.<Integer>fail(styleSetNotFound(setName, op)));
        }
        if (document == null) {
            return report(Result.<Integer>fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "文档不能为空", op)));
        }

        // 1. 解析集合中的样式并按类型分组
        List<String> tableStyles = new ArrayList<>();
        String paragraphStyle = null;
        String characterStyle = null;
        for (String styleName : set.getIncludedStyles()) {
            Style style = styles.get(styleName);
            if (style == null) {
                return report(Result.<Integer>fail(new StyleError(ErrorCode.STYLE_NOT_FOUND,
                        "样式集 " + setName + " 引用的样式已不存在: " + styleName,
                        ErrorContext.forOperation(op).with("style_set", setName).with("style", styleName))));
            }
            switch (style.getType()) {
                case TABLE:
                    tableStyles.add(styleName);
                    break;
                case PARAGRAPH:
                case MIXED:
                    if (paragraphStyle == null) {
                        paragraphStyle = styleName;
                    }
                    break;
                case CHARACTER:
                    if (characterStyle == null) {
                        characterStyle = styleName;
                    }
                    break;
                default:
                    log.debug("样式集 {} 中的样式 {} 类型为 {}，不参与级联应用", setName, styleName, style.getType());
            }
        }

        List<StyleError> failures = new ArrayList<>();
        int applied = 0;

        // 2. 表格
        for (TableElement table : document.getTables()) {
            for (String styleName : tableStyles) {
                if (collect(doApplyTableStyle(table, styleName), failures)) {
                    applied++;
                }
            }
        }

        // 3. 没有样式的段落
        if (paragraphStyle != null) {
            for (ParagraphElement paragraph : document.getParagraphs()) {
                if (isUnstyled(paragraph, failures) && collect(doApplyParagraphStyle(paragraph, paragraphStyle), failures)) {
                    applied++;
                }
            }
        }

        // 4. 没有样式的文本片段
        if (characterStyle != null) {
            for (RunElement run : document.getRuns()) {
                if (isUnstyled(run, failures) && collect(doApplyCharacterStyle(run, characterStyle), failures)) {
                    applied++;
                }
            }
        }

        log.info("应用样式集 {} 完成: 成功 {} 个元素, 失败 {} 个", setName, applied, failures.size());
        if (!failures.isEmpty()) {
            return report(Result.<Integer>fail(batchFailure(op, "样式集部分应用失败", failures)
                    .causedBy(failures.get(0))));
        }
        return Result.ok(applied);
    }

    /**
     * 按模式把文档中已有的样式映射为新样式，例如 heading1 → CustomHeading
     *
     * 目标样式必须全部存在，否则不做任何修改
     *
     * @return 重新设置样式的元素个数
     */
    public Result<Integer> applyStyleMappings(StyledDocument document, Map<String, String> mappings) {
        String op = "apply_style_mappings";
        if (document == null) {
            return report(Result.<Integer>fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "文档不能为空", op)));
        }
        if (mappings == null || mappings.isEmpty()) {
            return Result.ok(0);
        }
        for (Map.Entry<String, String> entry : mappings.entrySet()) {
            if (!hasStyle(entry.getValue())) {
                return report(Result.<Integer>fail(new StyleError(ErrorCode.STYLE_NOT_FOUND,
                        "映射目标样式不存在: " + entry.getValue(),
                        ErrorContext.forOperation(op).with("pattern", entry.getKey()).with("style", entry.getValue()))));
            }
        }

        List<StyleError> failures = new ArrayList<>();
        int applied = 0;
        for (Map.Entry<String, String> entry : mappings.entrySet()) {
            StyleMappingPattern pattern = StyleMappingPattern.parse(entry.getKey());
            String target = entry.getValue();
            StyleType targetType = styles.get(target).getType();

            if (targetType == StyleType.TABLE) {
                for (TableElement table : document.getTables()) {
                    if (matches(table, pattern, Kind.TABLE, failures)
                            && collect(doApplyTableStyle(table, target), failures)) {
                        applied++;
                    }
                }
                continue;
            }
            if (targetType != StyleType.CHARACTER) {
                for (ParagraphElement paragraph : document.getParagraphs()) {
                    if (matches(paragraph, pattern, Kind.PARAGRAPH, failures)
                            && collect(doApplyParagraphStyle(paragraph, target), failures)) {
                        applied++;
                    }
                }
            }
            if (targetType.allowsCharacterProperties()) {
                for (RunElement run : document.getRuns()) {
                    if (matches(run, pattern, Kind.RUN, failures)
                            && collect(doApplyCharacterStyle(run, target), failures)) {
                        applied++;
                    }
                }
            }
        }

        log.info("样式映射完成: 映射 {} 条, 成功 {} 个元素, 失败 {} 个", mappings.size(), applied, failures.size());
        if (!failures.isEmpty()) {
            return report(Result.<Integer>fail(batchFailure(op, "样式映射部分失败", failures)
                    .causedBy(failures.get(0))));
        }
        return Result.ok(applied);
    }

    private enum Kind {
        PARAGRAPH,
        RUN,
        TABLE
    }

    private boolean matches(StyledElement element, StyleMappingPattern pattern, Kind kind, List<StyleError> failures) {
        String current;
        try {
            current = element.getStyleName();
        } catch (RuntimeException e) {
            failures.add(this.<Void>elementFailure("apply_style_mappings", e).getError());
            return false;
        }
        switch (kind) {
            case PARAGRAPH:
                return pattern.matchesParagraph(current);
            case RUN:
                return pattern.matchesRun(current);
            default:
                return pattern.matchesTable(current);
        }
    }

    private boolean isUnstyled(StyledElement element, List<StyleError> failures) {
        try {
            return element.getStyleName() == null;
        } catch (RuntimeException e) {
            failures.add(this.<Void>elementFailure("apply_style_set", e).getError());
            return false;
        }
    }

    private static boolean collect(Result<Void> result, List<StyleError> failures) {
        if (result.isFailed()) {
            failures.add(result.getError());
            return false;
        }
        return true;
    }

    private static StyleError batchFailure(String op, String message, List<StyleError> failures) {
        return new StyleError(ErrorCode.ELEMENT_OPERATION_FAILED, message + ": " + failures.size() + " 个元素失败",
                ErrorContext.forOperation(op).with("failures", failures.size()));
    }

    // ==================== 提取与比较 ====================

    /**
     * 根据元素当前的直接格式创建新样式：段落 → PARAGRAPH，文本片段 → CHARACTER，表格 → TABLE
     */
    public Result<Style> extractStyleFromElement(StyledElement element, final String newStyleName) {
        final String op = "extract_style_from_element";
        if (element == null) {
            return report(Result.<Style>fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "元素不能为空", op)));
        }
        Result<Void> nameCheck = checkNewName(newStyleName, op);
        if (nameCheck.isFailed()) {
            return report(nameCheck.<Style>propagate());
        }

        Result<Style> built = element.accept(new StyledElementVisitor<Result<Style>>() {
            @Override
            public Result<Style> visitParagraph(ParagraphElement paragraph) {
                Style style = new Style(newStyleName, StyleType.PARAGRAPH);
                return doReadParagraph(paragraph).flatMap(props -> style.setParagraphProperties(props).map(ignored -> style));
            }

            @Override
            public Result<Style> visitRun(RunElement run) {
                Style style = new Style(newStyleName, StyleType.CHARACTER);
                return doReadCharacter(run).flatMap(props -> style.setCharacterProperties(props).map(ignored -> style));
            }

            @Override
            public Result<Style> visitTable(TableElement table) {
                Style style = new Style(newStyleName, StyleType.TABLE);
                return doReadTable(table).flatMap(props -> style.setTableProperties(props).map(ignored -> style));
            }
        });
        if (built.isFailed()) {
            return report(built);
        }
        return report(doRegisterStyle(built.getValue()));
    }

    /**
     * 生成两个样式之间差异的可读报告（只比较样式自身设置的属性）
     */
    public Result<String> compareStyles(String firstName, String secondName) {
        String op = "compare_styles";
        Result<Style> first = lookup(firstName, op);
        if (first.isFailed()) {
            return report(first.<String>propagate());
        }
        Result<Style> second = lookup(secondName, op);
        if (second.isFailed()) {
            return report(second.<String>propagate());
        }
        Style a = first.getValue();
        Style b = second.getValue();
        ParagraphStyleProperties pa = a.getParagraphProperties();
        ParagraphStyleProperties pb = b.getParagraphProperties();
        CharacterStyleProperties ca = a.getCharacterProperties();
        CharacterStyleProperties cb = b.getCharacterProperties();

        StringBuilder report = new StringBuilder();
        report.append("样式对比: '").append(a.getName()).append("' vs '").append(b.getName()).append("'\n");
        int before = report.length();
        appendDifference(report, "类型", a.getType(), b.getType());
        appendDifference(report, "对齐", pa.getAlignment(), pb.getAlignment());
        appendDifference(report, "段前间距", pa.getSpaceBeforePts(), pb.getSpaceBeforePts());
        appendDifference(report, "段后间距", pa.getSpaceAfterPts(), pb.getSpaceAfterPts());
        appendDifference(report, "字体", ca.getFontName(), cb.getFontName());
        appendDifference(report, "字号", ca.getFontSizePts(), cb.getFontSizePts());
        appendDifference(report, "颜色", ca.getFontColorHex(), cb.getFontColorHex());
        if (report.length() == before) {
            report.append("未发现差异\n");
        }
        return Result.ok(report.toString());
    }

    private static void appendDifference(StringBuilder report, String label, Object left, Object right) {
        if (!Objects.equals(left, right)) {
            report.append(label).append(": ").append(display(left)).append(" vs ").append(display(right)).append('\n');
        }
    }

    private static String display(Object value) {
        return value == null ? "(未设置)" : String.valueOf(value);
    }

    // ==================== 序列化 ====================

    /**
     * 生成包含全部样式的 styles.xml 内容，样式按名称排序
     */
    public String generateStylesXml() {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n");
        xml.append("<w:styles xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">\n");
        for (Style style : styles.values()) {
            xml.append(style.toMarkup());
        }
        xml.append("</w:styles>\n");
        return xml.toString();
    }

    /**
     * 按名称排序遍历注册表中的样式
     */
    public List<Style> getAllStyles() {
        return Collections.unmodifiableList(new ArrayList<>(styles.values()));
    }
}
