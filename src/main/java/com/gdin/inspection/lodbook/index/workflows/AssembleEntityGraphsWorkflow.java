package com.gdin.inspection.lodbook.index.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.lodbook.codec.LinkedDataCodec;
import com.gdin.inspection.lodbook.index.operation.GraphAssembler;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.EntityPage;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import com.gdin.inspection.lodbook.util.ConcurrentUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 第二阶段：所有文档处理完后，把提及信息并入每个实体的图谱并序列化。
 */
@Slf4j
@Service
public class AssembleEntityGraphsWorkflow {

    @Resource
    private GraphAssembler graphAssembler;

    @Resource
    private LinkedDataCodec codec;

    public List<EntityPage> run(BuildContext ctx,
                                List<EntityPage> pages,
                                List<NarrativeDocument> documents,
                                Integer concurrentRequests) {
        if (CollectionUtil.isEmpty(pages)) {
            log.warn("没有实体页面，跳过图谱合并");
            return new ArrayList<>();
        }
        List<NarrativeDocument> docs = documents == null ? List.of() : documents;
        log.info("开始合并实体图谱：pages={}, documents={}", pages.size(), docs.size());

        int threads = concurrentRequests == null ? 1 : concurrentRequests;
        ConcurrentUtil.mapInOrder(pages, threads, page -> assembleOne(ctx, page, docs));

        log.info("实体图谱合并完成");
        return pages;
    }

    private EntityPage assembleOne(BuildContext ctx, EntityPage page, List<NarrativeDocument> documents) {
        try {
            graphAssembler.assemble(ctx, page.getGraph(), documents);
        } catch (RuntimeException e) {
            log.error("实体图谱合并失败: {}", page.getName(), e);
            ctx.advise(AdvisoryKind.ITEM_FAILED, page.getName(), e.getMessage());
            return page;
        }
        // 编解码失败不兜底
        page.setJsonld(codec.toJsonLd(ctx.getLodContext(), page.getGraph().toGraph()));
        return page;
    }
}
