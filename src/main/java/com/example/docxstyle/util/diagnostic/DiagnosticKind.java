package com.example.docxstyle.util.diagnostic;

/**
 * 诊断类型
 */
public enum DiagnosticKind {

    /** 期望的XML部件不存在（styles/numbering/theme/settings/document），使用默认值 */
    MISSING_PART,

    /** 结构查询失败或返回了意外结构，按"无匹配"处理 */
    QUERY_FAILURE,

    /** 无法解析的引用：悬空的basedOn、缺失的abstractNum等 */
    UNRESOLVABLE_REFERENCE,

    /** 单个节点格式错误，已跳过 */
    MALFORMED_NODE,

    /** 样式表生成失败，已回退到固定基础样式表 */
    SYNTHESIS_FALLBACK
}
