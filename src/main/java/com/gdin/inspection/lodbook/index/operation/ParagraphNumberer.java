package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.models.BuildContext;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * 给正文段落和引用块编号（para-0, quote-0 ...），供提及定位使用。
 */
@Component
public class ParagraphNumberer {

    public static final String PARA_PREFIX = "para-";
    public static final String QUOTE_PREFIX = "quote-";

    public void number(BuildContext ctx, Document html) {
        Elements paras = html.select(ctx.getTextBlockSelector());
        for (int i = 0; i < paras.size(); i++) {
            paras.get(i).attr("id", PARA_PREFIX + i);
        }
        Elements quotes = html.select(ctx.getQuoteSelector());
        for (int i = 0; i < quotes.size(); i++) {
            quotes.get(i).attr("id", QUOTE_PREFIX + i);
        }
    }
}
