package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Data;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * 已渲染的叙事文档（章节页面）。
 * html 为解析后的文本树，只在第一阶段被修改；output 为最终序列化结果。
 */
@Data
@Builder
public class NarrativeDocument {
    private String title;
    private String chapter;
    /** 站内相对地址，例如 /chapters/one/ */
    private String url;
    private String output;

    private Document html;
    private ReferenceIndex references;
    private DocumentGraph graph;

    public Document parsed() {
        if (html == null) {
            html = Jsoup.parse(output == null ? "" : output);
            html.outputSettings().prettyPrint(false);
        }
        return html;
    }

    public boolean isEnriched() {
        return graph != null;
    }
}
