package com.gdin.inspection.lodbook.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 实体在某篇文档某个段落中的一次出现，以及其上下文片段。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Mention {

    @JsonProperty("document_title")
    String documentTitle;

    @JsonProperty("document_chapter")
    String documentChapter;

    @JsonProperty("document_url")
    String documentUrl;

    @JsonProperty("para")
    String paragraphId;

    @JsonProperty("context")
    String context;
}
