package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.codec.LinkedDataCodec;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.DocumentGraph;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.models.ReferenceIndex;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 生成叙事文档的图谱（WebPage + 提到的实体），并以 page-data 脚本嵌入页面。
 */
@Component
public class DocumentGraphBuilder {

    public static final String SCRIPT_ID = "page-data";

    private final GraphCompiler graphCompiler;
    private final LinkedDataCodec codec;

    public DocumentGraphBuilder(GraphCompiler graphCompiler, LinkedDataCodec codec) {
        this.graphCompiler = graphCompiler;
        this.codec = codec;
    }

    public DocumentGraph build(BuildContext ctx, NarrativeDocument document, ReferenceIndex index) {
        List<Map<String, Object>> mentions = new ArrayList<>();
        Set<String> seenIds = new LinkedHashSet<>();
        for (String name : index.resolvedNames()) {
            Optional<Record> record = ctx.getRecordStore().findByName(name);
            if (record.isEmpty()) {
                ctx.advise(AdvisoryKind.UNRESOLVED_REFERENCE, name, "文档中的链接指向不存在的记录: " + document.getUrl());
                continue;
            }
            Map<String, Object> graph = graphCompiler.hydrate(ctx, record.get()).toGraph();
            if (seenIds.add(String.valueOf(graph.get("@id")))) {
                mentions.add(graph);
            }
        }

        return DocumentGraph.builder()
                .id(ctx.pageUri(document.getUrl()))
                .name("Chapter " + document.getChapter() + ": " + document.getTitle())
                .mentions(mentions)
                .build();
    }

    /**
     * 序列化失败（{@link com.gdin.inspection.lodbook.codec.LinkedDataCodecException}）直接抛给调用方。
     */
    public String embed(BuildContext ctx, Document html, DocumentGraph graph) {
        String jsonld = codec.toJsonLd(ctx.getLodContext(), graph.toGraph());
        Element script = html.body().appendElement("script");
        script.attr("id", SCRIPT_ID);
        script.attr("type", "application/ld+json");
        script.appendChild(new DataNode(jsonld));
        return jsonld;
    }
}
