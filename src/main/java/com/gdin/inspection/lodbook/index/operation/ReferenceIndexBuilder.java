package com.gdin.inspection.lodbook.index.operation;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.ReferenceIndex;
import com.gdin.inspection.lodbook.models.ResolvedReference;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 从显式标记渲染出的链接（a[property=name]）收集 可见标签 -> 引用。
 * 同一标签出现多次时以最后一次为准。
 */
@Component
public class ReferenceIndexBuilder {

    public ReferenceIndex build(BuildContext ctx, Document html) {
        Map<String, ResolvedReference> references = new LinkedHashMap<>();
        for (Element para : html.select(ctx.getTextBlockSelector())) {
            for (Element link : para.select("a[property=name]")) {
                String label = link.text();
                String name = link.attr(LabelMarkupEngine.ATTR_NAME);
                if (StrUtil.isBlank(label) || StrUtil.isBlank(name)) continue;
                references.put(label, ResolvedReference.builder()
                        .label(label)
                        .name(name)
                        .collection(link.attr(LabelMarkupEngine.ATTR_COLLECTION))
                        .url(link.attr("href"))
                        .build());
            }
        }
        return new ReferenceIndex(references);
    }
}
