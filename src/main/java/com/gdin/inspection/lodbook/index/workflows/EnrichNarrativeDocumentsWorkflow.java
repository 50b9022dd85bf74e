package com.gdin.inspection.lodbook.index.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.lodbook.codec.LinkedDataCodecException;
import com.gdin.inspection.lodbook.index.operation.DocumentGraphBuilder;
import com.gdin.inspection.lodbook.index.operation.LabelMarkupEngine;
import com.gdin.inspection.lodbook.index.operation.ParagraphNumberer;
import com.gdin.inspection.lodbook.index.operation.ReferenceIndexBuilder;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.DocumentGraph;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import com.gdin.inspection.lodbook.models.ReferenceIndex;
import com.gdin.inspection.lodbook.util.ConcurrentUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 第一阶段：逐篇处理已渲染的叙事文档。
 * 段落编号 -> 收集显式标记 -> 标签补链 -> 生成并嵌入文档图谱。
 */
@Slf4j
@Service
public class EnrichNarrativeDocumentsWorkflow {

    @Resource
    private ParagraphNumberer paragraphNumberer;

    @Resource
    private ReferenceIndexBuilder referenceIndexBuilder;

    @Resource
    private LabelMarkupEngine labelMarkupEngine;

    @Resource
    private DocumentGraphBuilder documentGraphBuilder;

    /**
     * @return 成功完成处理的文档（保持输入顺序）
     */
    public List<NarrativeDocument> run(BuildContext ctx, List<NarrativeDocument> documents, Integer concurrentRequests) {
        if (CollectionUtil.isEmpty(documents)) {
            log.warn("没有叙事文档，跳过补链");
            return new ArrayList<>();
        }
        log.info("开始处理叙事文档：documents={}", documents.size());

        int threads = concurrentRequests == null ? 1 : concurrentRequests;
        List<NarrativeDocument> enriched = ConcurrentUtil.mapInOrder(documents, threads, doc -> enrichOne(ctx, doc))
                .stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        log.info("叙事文档处理完成：enriched={}, failed={}", enriched.size(), documents.size() - enriched.size());
        return enriched;
    }

    public NarrativeDocument enrich(BuildContext ctx, NarrativeDocument document) {
        Document html = document.parsed();
        paragraphNumberer.number(ctx, html);

        ReferenceIndex index = referenceIndexBuilder.build(ctx, html);
        int added = labelMarkupEngine.markup(ctx, html, index);

        DocumentGraph graph = documentGraphBuilder.build(ctx, document, index);
        documentGraphBuilder.embed(ctx, html, graph);

        document.setReferences(index);
        document.setGraph(graph);
        document.setOutput(html.outerHtml());
        log.info("文档 {}：labels={}, 新增链接={}, mentions={}",
                document.getTitle(), index.size(), added, graph.getMentions().size());
        return document;
    }

    private NarrativeDocument enrichOne(BuildContext ctx, NarrativeDocument document) {
        try {
            return enrich(ctx, document);
        } catch (LinkedDataCodecException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("叙事文档处理失败: {}", document.getUrl(), e);
            ctx.advise(AdvisoryKind.ITEM_FAILED, document.getUrl(), e.getMessage());
            return null;
        }
    }
}
