package com.gdin.inspection.lodbook.index.operation;

import cn.hutool.core.util.StrUtil;
import cn.hutool.http.HtmlUtil;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.Record;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 渲染正文中的显式标记与忽略标记。
 */
@Component
public class MarkerRenderer {

    /**
     * 显式标记：name 为空时用标记内容本身查找记录。
     * 找到则输出带 data-name/data-collection 的链接，否则原样输出内容。
     */
    public String renderLink(BuildContext ctx, String name, String content) {
        String body = content == null ? "" : content;
        String lookup = StrUtil.isBlank(name) ? body.trim() : name.trim();
        if (lookup.isEmpty()) {
            ctx.advise(AdvisoryKind.MALFORMED_MARKER, body, "标记缺少实体名");
            return body;
        }

        Optional<Record> record = ctx.getRecordStore().findByName(lookup);
        if (record.isEmpty()) {
            ctx.advise(AdvisoryKind.UNRESOLVED_REFERENCE, lookup, "标记指向的记录不存在");
            return body;
        }

        String collection = ctx.getTypeRegistry().collection(record.get().getType());
        String url = ctx.relativeEntityUrl(collection, lookup);
        return "<a class=\"" + LabelMarkupEngine.LINK_CLASS + "\""
                + " data-name=\"" + HtmlUtil.escape(lookup) + "\""
                + " data-collection=\"" + HtmlUtil.escape(StrUtil.nullToEmpty(collection)) + "\""
                + " property=\"name\""
                + " href=\"" + HtmlUtil.escape(url) + "\">"
                + body + "</a>";
    }

    public String renderIgnore(String content) {
        return "<span class=\"" + LabelMarkupEngine.IGNORE_CLASS + "\">" + StrUtil.nullToEmpty(content) + "</span>";
    }
}
