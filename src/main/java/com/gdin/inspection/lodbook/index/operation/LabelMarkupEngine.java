package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.doc.tokenizer.WordTokenizer;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.ReferenceIndex;
import com.gdin.inspection.lodbook.models.ResolvedReference;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把文档中已被显式标记过的标签的其余出现也加上链接。
 * <p>
 * 标签按长度降序处理，长标签（"James Minahan"）先整体成链，之后较短的标签（"James"）不会再拆开它。
 * 已有链接、lod-ignore 片段一律跳过。
 */
@Slf4j
@Component
public class LabelMarkupEngine {

    public static final String LINK_CLASS = "lod-link";
    public static final String IGNORE_CLASS = "lod-ignore";
    public static final String ATTR_NAME = "data-name";
    public static final String ATTR_COLLECTION = "data-collection";

    private final WordTokenizer tokenizer;

    public LabelMarkupEngine(WordTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * @return 新增的链接数
     */
    public int markup(BuildContext ctx, Document html, ReferenceIndex index) {
        if (index == null || index.isEmpty()) return 0;

        List<String> labels = index.labelsByLengthDesc();
        int added = 0;
        for (Element block : html.select(ctx.getTextBlockSelector())) {
            for (String label : labels) {
                added += markupBlock(block, label, index.get(label));
            }
        }
        log.debug("标签补链完成：labels={}, added={}", labels.size(), added);
        return added;
    }

    /**
     * 对一个段落重建子节点序列：命中的文本被拆成 文本/链接/文本 兄弟节点，其余节点原样保留。
     */
    int markupBlock(Element block, String label, ResolvedReference reference) {
        List<Node> originals = new ArrayList<>(block.childNodes());
        List<Node> rebuilt = new ArrayList<>(originals.size());
        int added = 0;
        boolean changed = false;

        for (Node child : originals) {
            if (isSkipped(child)) {
                rebuilt.add(child);
                continue;
            }
            if (child instanceof TextNode) {
                String text = ((TextNode) child).getWholeText();
                List<int[]> spans = tokenizer.findWholeWord(text, label);
                if (spans.isEmpty()) {
                    rebuilt.add(child);
                    continue;
                }
                int pos = 0;
                for (int[] span : spans) {
                    if (span[0] > pos) rebuilt.add(new TextNode(text.substring(pos, span[0])));
                    Element link = createLink(reference);
                    link.appendChild(new TextNode(text.substring(span[0], span[1])));
                    rebuilt.add(link);
                    pos = span[1];
                    added++;
                }
                if (pos < text.length()) rebuilt.add(new TextNode(text.substring(pos)));
                changed = true;
            } else if (child instanceof Element && label.equals(((Element) child).wholeText())) {
                wrapInner((Element) child, reference);
                rebuilt.add(child);
                added++;
            } else {
                rebuilt.add(child);
            }
        }

        if (changed) {
            for (Node node : originals) {
                node.remove();
            }
            block.appendChildren(rebuilt);
        }
        return added;
    }

    /**
     * 整个文本恰好等于标签的内联元素（如 em）：把原有内容包进链接。
     */
    private void wrapInner(Element element, ResolvedReference reference) {
        Element link = createLink(reference);
        List<Node> inner = new ArrayList<>(element.childNodes());
        for (Node node : inner) {
            node.remove();
        }
        link.appendChildren(inner);
        element.appendChild(link);
    }

    /**
     * 已成链、显式忽略的节点，以及内部已含链接或忽略片段的元素都不处理。
     */
    private boolean isSkipped(Node node) {
        if (!(node instanceof Element)) return false;
        Element element = (Element) node;
        if ("a".equals(element.tagName())
                || element.hasClass(LINK_CLASS)
                || element.hasClass(IGNORE_CLASS)) {
            return true;
        }
        return !element.select("a, ." + IGNORE_CLASS).isEmpty();
    }

    Element createLink(ResolvedReference reference) {
        Element link = new Element("a");
        link.attr("class", LINK_CLASS);
        link.attr(ATTR_NAME, reference.getName());
        link.attr(ATTR_COLLECTION, reference.getCollection() == null ? "" : reference.getCollection());
        link.attr("property", "name");
        link.attr("href", reference.getUrl() == null ? "" : reference.getUrl());
        return link;
    }
}
