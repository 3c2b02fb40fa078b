package com.example.docxstyle.util.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一份样式定义文档的解析结果
 */
public class StyleSheetDefinition {

    private final List<Style> styles;
    private final List<StyleSet> styleSets;

    public StyleSheetDefinition(List<Style> styles, List<StyleSet> styleSets) {
        this.styles = Collections.unmodifiableList(new ArrayList<>(styles));
        this.styleSets = Collections.unmodifiableList(new ArrayList<>(styleSets));
    }

    public List<Style> getStyles() {
        return styles;
    }

    public List<StyleSet> getStyleSets() {
        return styleSets;
    }
}
