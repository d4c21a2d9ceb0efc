package com.example.docxstyle.exception;

/**
 * 转换无法进行时抛出：上传内容不是OOXML包，或五个XML部件全部缺失
 */
public class DocxStyleException extends RuntimeException {

    public DocxStyleException(String message) {
        super(message);
    }

    public DocxStyleException(String message, Throwable cause) {
        super(message, cause);
    }
}
