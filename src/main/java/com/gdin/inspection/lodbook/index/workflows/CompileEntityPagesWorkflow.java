package com.gdin.inspection.lodbook.index.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.lodbook.codec.LinkedDataCodecException;
import com.gdin.inspection.lodbook.index.operation.EntityPageBuilder;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.EntityPage;
import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.util.ConcurrentUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 第零阶段：为每条记录编译实体图谱与页面数据。
 */
@Slf4j
@Service
public class CompileEntityPagesWorkflow {

    @Resource
    private EntityPageBuilder entityPageBuilder;

    public List<EntityPage> run(BuildContext ctx, List<Record> records, Integer concurrentRequests) {
        if (CollectionUtil.isEmpty(records)) {
            log.warn("没有实体记录，跳过实体页面编译");
            return new ArrayList<>();
        }
        log.info("开始编译实体页面：records={}", records.size());

        int threads = concurrentRequests == null ? 1 : concurrentRequests;
        List<EntityPage> pages = ConcurrentUtil.mapInOrder(records, threads, record -> compileOne(ctx, record))
                .stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        log.info("实体页面编译完成：pages={}, skipped={}", pages.size(), records.size() - pages.size());
        return pages;
    }

    private EntityPage compileOne(BuildContext ctx, Record record) {
        try {
            Optional<EntityPage> page = entityPageBuilder.build(ctx, record);
            return page.orElse(null);
        } catch (LinkedDataCodecException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("实体记录编译失败: {}", record.getName(), e);
            ctx.advise(AdvisoryKind.ITEM_FAILED, record.getName(), e.getMessage());
            return null;
        }
    }
}
