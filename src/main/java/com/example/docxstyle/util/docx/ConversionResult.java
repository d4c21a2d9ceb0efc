package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.css.CssClassNames;
import com.example.docxstyle.util.diagnostic.Diagnostic;
import com.example.docxstyle.util.numbering.NumberingTable;
import com.example.docxstyle.util.reconstruct.DocumentTree;
import com.example.docxstyle.util.structure.ParagraphRecord;
import com.example.docxstyle.util.structure.StructureModel;
import com.example.docxstyle.util.style.DocumentSettings;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.style.ThemeInfo;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个文档的转换结果（尽力而为）：样式表、结构模型、文档树和诊断信息
 *
 * 样式表/编号表等中间实体只在进程内使用，不参与JSON序列化。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResult {

    @JsonProperty("css")
    private String css;

    @JsonProperty("structure")
    private StructureModel structure;

    @JsonProperty("tree")
    private DocumentTree tree;

    @JsonProperty("diagnostics")
    private List<Diagnostic> diagnostics = new ArrayList<>();

    @JsonProperty("paragraph_count")
    private int paragraphCount;

    @JsonProperty("style_count")
    private int styleCount;

    @JsonIgnore
    private StyleTable styles;

    @JsonIgnore
    private NumberingTable numbering;

    @JsonIgnore
    private ThemeInfo theme;

    @JsonIgnore
    private DocumentSettings settings;

    @JsonIgnore
    private CssClassNames classNames;

    @JsonIgnore
    private List<ParagraphRecord> paragraphs;

    // Getters and Setters
    public String getCss() { return css; }
    public void setCss(String css) { this.css = css; }

    public StructureModel getStructure() { return structure; }
    public void setStructure(StructureModel structure) { this.structure = structure; }

    public DocumentTree getTree() { return tree; }
    public void setTree(DocumentTree tree) { this.tree = tree; }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public void setDiagnostics(List<Diagnostic> diagnostics) { this.diagnostics = diagnostics; }

    public int getParagraphCount() { return paragraphCount; }
    public void setParagraphCount(int paragraphCount) { this.paragraphCount = paragraphCount; }

    public int getStyleCount() { return styleCount; }
    public void setStyleCount(int styleCount) { this.styleCount = styleCount; }

    public StyleTable getStyles() { return styles; }
    public void setStyles(StyleTable styles) { this.styles = styles; }

    public NumberingTable getNumbering() { return numbering; }
    public void setNumbering(NumberingTable numbering) { this.numbering = numbering; }

    public ThemeInfo getTheme() { return theme; }
    public void setTheme(ThemeInfo theme) { this.theme = theme; }

    public DocumentSettings getSettings() { return settings; }
    public void setSettings(DocumentSettings settings) { this.settings = settings; }

    public CssClassNames getClassNames() { return classNames; }
    public void setClassNames(CssClassNames classNames) { this.classNames = classNames; }

    public List<ParagraphRecord> getParagraphs() { return paragraphs; }
    public void setParagraphs(List<ParagraphRecord> paragraphs) { this.paragraphs = paragraphs; }
}
