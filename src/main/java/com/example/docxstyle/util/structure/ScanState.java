package com.example.docxstyle.util.structure;

/**
 * 结构分析状态
 */
enum ScanState {
    SCANNING,
    IN_TOC
}
