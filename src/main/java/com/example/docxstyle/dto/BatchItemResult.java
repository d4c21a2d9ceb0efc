package com.example.docxstyle.dto;

import com.example.docxstyle.util.docx.ConversionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 批量转换中单个文档的结果，失败时只带错误信息
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResult {

    @JsonProperty("index")
    private int index;

    @JsonProperty("name")
    private String name;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("error")
    private String error;

    @JsonProperty("result")
    private ConversionResult result;

    public BatchItemResult() {
    }

    public static BatchItemResult success(int index, String name, ConversionResult result) {
        BatchItemResult item = new BatchItemResult();
        item.index = index;
        item.name = name;
        item.success = true;
        item.result = result;
        return item;
    }

    public static BatchItemResult failure(int index, String name, String error) {
        BatchItemResult item = new BatchItemResult();
        item.index = index;
        item.name = name;
        item.success = false;
        item.error = error;
        return item;
    }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public ConversionResult getResult() { return result; }
    public void setResult(ConversionResult result) { this.result = result; }
}
