package com.example.docxstyle.util.diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次转换的诊断收集器
 *
 * 每次转换新建一个实例，不在文档之间共享。
 * 各解析阶段在自身边界捕获异常后记录到这里，然后继续处理剩余节点。
 */
public class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void add(DiagnosticKind kind, String source, String message) {
        entries.add(new Diagnostic(kind, source, message));
    }

    public List<Diagnostic> list() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public boolean has(DiagnosticKind kind) {
        for (Diagnostic d : entries) {
            if (d.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    public long count(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).count();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
