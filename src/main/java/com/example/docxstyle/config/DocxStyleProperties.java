package com.example.docxstyle.config;

import com.example.docxstyle.util.css.SynthesisOptions;
import com.example.docxstyle.util.docx.PipelineOptions;
import com.example.docxstyle.util.reconstruct.RenderOptions;
import com.example.docxstyle.util.structure.AnalyzerOptions;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.xml.WordNamespaces;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务配置（application.yml 中 docx-style 前缀）
 */
@ConfigurationProperties(prefix = "docx-style")
public class DocxStyleProperties {

    /** 命名空间前缀覆盖，未配置的前缀使用内置的 Office 2006 命名空间 */
    private Map<String, String> namespaces = new LinkedHashMap<>();

    private final Styles styles = new Styles();

    private final Toc toc = new Toc();

    private final Patterns patterns = new Patterns();

    private final Render render = new Render();

    private final Batch batch = new Batch();

    private final Cors cors = new Cors();

    public Map<String, String> getNamespaces() { return namespaces; }
    public void setNamespaces(Map<String, String> namespaces) { this.namespaces = namespaces; }

    public Styles getStyles() { return styles; }

    public Toc getToc() { return toc; }

    public Patterns getPatterns() { return patterns; }

    public Render getRender() { return render; }

    public Batch getBatch() { return batch; }

    public Cors getCors() { return cors; }

    public PipelineOptions toPipelineOptions() {
        return PipelineOptions.builder()
                .namespaces(WordNamespaces.of(namespaces))
                .maxBasedOnHops(styles.getMaxBasedOnHops())
                .synthesis(SynthesisOptions.builder()
                        .flattenBasedOn(styles.isFlattenBasedOn())
                        .build())
                .analyzer(AnalyzerOptions.builder()
                        .tocExitMinEntries(toc.getExitMinEntries())
                        .minOccurrences(patterns.getMinOccurrences())
                        .maxExamples(patterns.getMaxExamples())
                        .build())
                .build();
    }

    public RenderOptions toRenderOptions() {
        return RenderOptions.builder()
                .showTocPageNumbers(render.isShowTocPageNumbers())
                .tocLineWidth(render.getTocLineWidth())
                .build();
    }

    public static class Styles {
        /** basedOn 链最大跳数，超过视为断链 */
        private int maxBasedOnHops = StyleTable.DEFAULT_MAX_HOPS;
        private boolean flattenBasedOn = true;

        public int getMaxBasedOnHops() { return maxBasedOnHops; }
        public void setMaxBasedOnHops(int maxBasedOnHops) { this.maxBasedOnHops = maxBasedOnHops; }

        public boolean isFlattenBasedOn() { return flattenBasedOn; }
        public void setFlattenBasedOn(boolean flattenBasedOn) { this.flattenBasedOn = flattenBasedOn; }
    }

    public static class Toc {
        private int exitMinEntries = 5;

        public int getExitMinEntries() { return exitMinEntries; }
        public void setExitMinEntries(int exitMinEntries) { this.exitMinEntries = exitMinEntries; }
    }

    public static class Patterns {
        private int minOccurrences = 2;
        private int maxExamples = 3;

        public int getMinOccurrences() { return minOccurrences; }
        public void setMinOccurrences(int minOccurrences) { this.minOccurrences = minOccurrences; }

        public int getMaxExamples() { return maxExamples; }
        public void setMaxExamples(int maxExamples) { this.maxExamples = maxExamples; }
    }

    public static class Render {
        private boolean showTocPageNumbers = true;
        private int tocLineWidth = 60;

        public boolean isShowTocPageNumbers() { return showTocPageNumbers; }
        public void setShowTocPageNumbers(boolean showTocPageNumbers) { this.showTocPageNumbers = showTocPageNumbers; }

        public int getTocLineWidth() { return tocLineWidth; }
        public void setTocLineWidth(int tocLineWidth) { this.tocLineWidth = tocLineWidth; }
    }

    public static class Batch {
        /** 批量转换并发数 */
        private int parallelism = 4;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
