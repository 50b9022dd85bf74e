package com.gdin.inspection.lodbook.index.operation;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.Mention;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 找出文档中指向某实体的全部链接，并为每一次出现截取前后若干词作为上下文。
 */
@Component
public class MentionExtractor {

    public List<Mention> extract(BuildContext ctx, NarrativeDocument document, String entityName) {
        List<Mention> mentions = new ArrayList<>();
        if (StrUtil.isBlank(entityName)) return mentions;

        Elements paras = document.parsed().select(ctx.getTextBlockSelector());
        for (int i = 0; i < paras.size(); i++) {
            Element para = paras.get(i);
            String paraId = paragraphId(para, i);
            // 按文档顺序返回，即段内从左到右
            for (Element link : para.getElementsByAttributeValue(LabelMarkupEngine.ATTR_NAME, entityName)) {
                if (!"a".equals(link.tagName())) continue;
                mentions.add(Mention.builder()
                        .documentTitle(document.getTitle())
                        .documentChapter(document.getChapter())
                        .documentUrl(document.getUrl())
                        .paragraphId(paraId)
                        .context(context(para, link, ctx.getContextWords()))
                        .build());
            }
        }
        return mentions;
    }

    /**
     * "前 n 个词 <em>标签</em> 后 n 个词"，标签之外的标记全部去掉。
     */
    String context(Element para, Element link, int words) {
        ContextCollector collector = new ContextCollector(link);
        NodeTraversor.traverse(collector, para);

        String before = joinWords(lastWords(collector.before.toString(), words));
        String after = joinWords(firstWords(collector.after.toString(), words));
        // 只转义 & < >，引号保持原样
        String label = Entities.escape(link.text());
        return (Entities.escape(before) + " <em>" + label + "</em> " + Entities.escape(after)).trim();
    }

    private static String paragraphId(Element para, int index) {
        String id = para.id();
        int dash = id.indexOf('-');
        if (dash < 0 || dash == id.length() - 1) return String.valueOf(index);
        return id.substring(dash + 1);
    }

    private static List<String> splitWords(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return List.of();
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private static List<String> lastWords(String text, int n) {
        List<String> words = splitWords(text);
        return words.subList(Math.max(0, words.size() - n), words.size());
    }

    private static List<String> firstWords(String text, int n) {
        List<String> words = splitWords(text);
        return words.subList(0, Math.min(n, words.size()));
    }

    private static String joinWords(List<String> words) {
        return String.join(" ", words);
    }

    /**
     * 遍历段落文本，按目标链接把文字分为 前 / 链接内 / 后 三段。
     */
    private static class ContextCollector implements NodeVisitor {
        private final Element target;
        private final StringBuilder before = new StringBuilder();
        private final StringBuilder after = new StringBuilder();
        private boolean inside;
        private boolean passed;

        ContextCollector(Element target) {
            this.target = target;
        }

        @Override
        public void head(Node node, int depth) {
            if (node == target) {
                inside = true;
                return;
            }
            if (inside || !(node instanceof TextNode)) return;
            String text = ((TextNode) node).getWholeText();
            if (passed) after.append(text);
            else before.append(text);
        }

        @Override
        public void tail(Node node, int depth) {
            if (node == target) {
                inside = false;
                passed = true;
            }
        }
    }
}
