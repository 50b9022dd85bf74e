package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.GraphNode;
import com.gdin.inspection.lodbook.models.Mention;
import com.gdin.inspection.lodbook.models.MentionedBy;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把叙事文档中的反向引用（mentionedBy）和提及上下文并入实体图谱。
 * 必须在所有文档完成补链之后调用，且每个实体每次构建只调用一次。
 */
@Slf4j
@Component
public class GraphAssembler {

    private final MentionExtractor mentionExtractor;

    public GraphAssembler(MentionExtractor mentionExtractor) {
        this.mentionExtractor = mentionExtractor;
    }

    /**
     * 没有任何文档提到该实体时不写 mentionedBy 键。
     */
    public GraphNode assemble(GraphNode graph, List<MentionedBy> mentionedBy, List<Mention> mentions) {
        if (graph == null) throw new IllegalArgumentException("graph 不能为空");
        synchronized (graph) {
            graph.merge(mentionedBy, mentions);
        }
        return graph;
    }

    /**
     * 扫描全部已补链的文档，收集提到该实体的文档及其上下文后合并。
     */
    public GraphNode assemble(BuildContext ctx, GraphNode graph, List<NarrativeDocument> documents) {
        List<MentionedBy> mentionedBy = new ArrayList<>();
        List<Mention> mentions = new ArrayList<>();

        for (NarrativeDocument document : documents) {
            if (!document.isEnriched()) {
                throw new IllegalStateException("文档尚未完成补链: " + document.getUrl());
            }
            if (!document.getGraph().mentionsEntity(graph.getId())) continue;

            mentionedBy.add(MentionedBy.webPage(document.getGraph().getId(), document.getTitle()));
            mentions.addAll(mentionExtractor.extract(ctx, document, graph.getName()));
        }
        log.debug("实体 {} 被 {} 篇文档提及，共 {} 处", graph.getName(), mentionedBy.size(), mentions.size());
        return assemble(graph, mentionedBy, mentions);
    }
}
