package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.structure.ParagraphRecord;
import com.example.docxstyle.util.xml.WordNamespaces;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * document.xml → 段落记录流
 *
 * 按文档顺序提取正文段落（含表格单元格内的段落，不含文本框中嵌套的段落），
 * 记录样式id、编号引用、TOC域开始标记和右对齐制表位前导符。
 */
@Slf4j
public class ParagraphRecordExtractor {

    private final WordXmlQuery query;

    public ParagraphRecordExtractor(WordXmlQuery query) {
        this.query = query;
    }

    public List<ParagraphRecord> extract(Document documentDoc) {
        List<ParagraphRecord> records = new ArrayList<>();
        if (documentDoc == null) {
            query.getDiagnostics().add(DiagnosticKind.MISSING_PART, "word/document.xml", "正文部件缺失，没有段落");
            return records;
        }

        int index = 0;
        for (Element p : query.selectElements("//w:body//w:p[not(ancestor::w:p)]", documentDoc)) {
            try {
                records.add(toRecord(p, index));
                index++;
            } catch (RuntimeException e) {
                log.warn("段落提取失败，已跳过: 段落 {} - {}", index, e.getMessage());
                query.getDiagnostics().add(DiagnosticKind.MALFORMED_NODE, "w:p#" + index, String.valueOf(e.getMessage()));
            }
        }
        log.debug("段落提取完成: {} 个段落", records.size());
        return records;
    }

    private ParagraphRecord toRecord(Element p, int index) {
        Element pPr = query.child(p, "w:pPr");
        Element numPr = query.child(pPr, "w:numPr");
        String numId = query.childAttr(numPr, "w:numId", "w:val");
        Integer level = numId != null ? query.intAttr(query.child(numPr, "w:ilvl"), "w:val") : null;
        if (numId != null && level == null) {
            level = 0;
        }

        StringBuilder text = new StringBuilder();
        appendText(p, text);

        return ParagraphRecord.builder()
                .index(index)
                .text(text.toString())
                .styleId(query.childAttr(pPr, "w:pStyle", "w:val"))
                .numId(numId)
                .level(level)
                .tocFieldBegin(hasTocField(p))
                .tabLeader(rightTabLeader(pPr))
                .build();
    }

    /**
     * 按文档顺序拼接文本：w:t 文本，w:tab 为制表符，w:br / w:cr 为换行；
     * 跳过删除文本、域指令和文本框内容
     */
    private void appendText(Element element, StringBuilder out) {
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (!(n instanceof Element)) {
                continue;
            }
            Element child = (Element) n;
            if (!WordNamespaces.W.equals(child.getNamespaceURI())) {
                // mc:AlternateContent（图形、文本框）整体跳过，其他命名空间的容器继续向下
                if (!"AlternateContent".equals(child.getLocalName())) {
                    appendText(child, out);
                }
                continue;
            }
            switch (child.getLocalName()) {
                case "t":
                    out.append(child.getTextContent());
                    break;
                case "tab":
                    out.append('\t');
                    break;
                case "br":
                case "cr":
                    out.append('\n');
                    break;
                case "delText":
                case "instrText":
                case "txbxContent":
                case "pPr":
                case "rPr":
                    break;
                default:
                    appendText(child, out);
            }
        }
    }

    private boolean hasTocField(Element p) {
        boolean begin = !query.selectElements(".//w:fldChar[@w:fldCharType='begin']", p).isEmpty();
        if (begin) {
            for (Element instr : query.selectElements(".//w:instrText", p)) {
                if (instr.getTextContent() != null && instr.getTextContent().contains("TOC")) {
                    return true;
                }
            }
        }
        for (Element simple : query.selectElements(".//w:fldSimple", p)) {
            String instr = query.attr(simple, "w:instr");
            if (instr != null && instr.contains("TOC")) {
                return true;
            }
        }
        return false;
    }

    private String rightTabLeader(Element pPr) {
        for (Element tab : query.children(query.child(pPr, "w:tabs"), "w:tab")) {
            String val = query.attr(tab, "w:val");
            String leader = query.attr(tab, "w:leader");
            if (("right".equals(val) || "end".equals(val)) && leader != null && !"none".equals(leader)) {
                return leader;
            }
        }
        return null;
    }
}
