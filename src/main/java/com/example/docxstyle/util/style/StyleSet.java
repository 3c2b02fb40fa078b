package com.example.docxstyle.util.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 样式集：按顺序引用一组样式名，整体应用到文档
 */
public class StyleSet {

    private final String name;
    private String description = "";
    private final List<String> includedStyles = new ArrayList<>();

    public StyleSet(String name) {
        this.name = name;
    }

    public StyleSet(StyleSet other) {
        this.name = other.name;
        this.description = other.description;
        this.includedStyles.addAll(other.includedStyles);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public List<String> getIncludedStyles() {
        return Collections.unmodifiableList(includedStyles);
    }

    public StyleSet addStyle(String styleName) {
        includedStyles.add(styleName);
        return this;
    }

    @Override
    public String toString() {
        return "StyleSet{name='" + name + "', styles=" + includedStyles + '}';
    }
}
