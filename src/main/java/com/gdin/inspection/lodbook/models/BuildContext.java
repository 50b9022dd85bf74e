package com.gdin.inspection.lodbook.models;

import com.gdin.inspection.lodbook.registry.TypeRegistry;
import com.gdin.inspection.lodbook.repository.RecordStore;
import com.gdin.inspection.lodbook.state.AdvisoryStore;
import com.gdin.inspection.lodbook.util.SlugUtil;
import lombok.Builder;
import lombok.Value;

/**
 * 一次构建的全部只读依赖，显式传给每个核心调用。
 */
@Value
@Builder
public class BuildContext {
    public static final String DEFAULT_CONTEXT = "http://schema.org/";

    RecordStore recordStore;
    TypeRegistry typeRegistry;
    AdvisoryStore advisories;

    @Builder.Default
    String siteUrl = "";
    @Builder.Default
    String baseUrl = "";
    @Builder.Default
    Object lodContext = DEFAULT_CONTEXT;

    @Builder.Default
    String textBlockSelector = "#text p";
    @Builder.Default
    String quoteSelector = "blockquote";
    @Builder.Default
    int contextWords = 5;

    /**
     * 实体的完整 URI：{url}{baseurl}/{collection}/{slug}/
     */
    public String entityUri(String collection, String name) {
        return siteUrl + relativeEntityUrl(collection, name);
    }

    /**
     * 站内链接：{baseurl}/{collection}/{slug}/
     */
    public String relativeEntityUrl(String collection, String name) {
        return baseUrl + "/" + collection + "/" + SlugUtil.slugify(name) + "/";
    }

    /**
     * 叙事页面的完整 URI：{url}{baseurl}{page.url}
     */
    public String pageUri(String pageUrl) {
        return siteUrl + baseUrl + (pageUrl == null ? "" : pageUrl);
    }

    public void advise(AdvisoryKind kind, String subject, String message) {
        if (advisories == null) return;
        advisories.record(Advisory.builder().kind(kind).subject(subject).message(message).build());
    }
}
