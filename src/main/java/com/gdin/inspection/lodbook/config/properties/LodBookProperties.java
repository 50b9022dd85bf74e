package com.gdin.inspection.lodbook.config.properties;

import com.gdin.inspection.lodbook.models.TypeMapping;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "gdin.lodbook")
@Component
public class LodBookProperties implements Serializable {
    private Site site = new Site();
    private Source source = new Source();
    // 记录 type -> {type, collection, template}
    private Map<String, TypeMapping> dataTypes = new LinkedHashMap<>();
    private Markup markup = new Markup();
    private Index index = new Index();

    @Data
    public static class Site implements Serializable {
        // 例如 https://example.org
        private String url = "";
        // 例如 /lodbook
        private String baseurl = "";
    }

    @Data
    public static class Source implements Serializable {
        // 实体数据文件，例如 classpath:data/records.json
        private String data;
        // 显式指定的 @context，优先于数据文件自带的
        private String context;
    }

    @Data
    public static class Markup implements Serializable {
        // 正文段落
        private String textBlockSelector = "#text p";
        // 引用块
        private String quoteSelector = "blockquote";
        // 上下文前后各取的词数
        private Integer contextWords = 5;
    }

    @Data
    public static class Index implements Serializable {
        // 并发处理的文档/实体数
        private Integer concurrentRequests = 1;
    }
}
