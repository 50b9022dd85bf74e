package com.gdin.inspection.lodbook.doc.tokenizer;

import com.gdin.inspection.lodbook.pojo.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 按词字符（字母、数字、下划线）切分文本，并给出每个词的偏移。
 * 词边界即为各词元的起止位置，与 locale 无关。
 */
@Component
public class WordTokenizer implements ITokenizer {

    public static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    @Override
    public List<Token> parse(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) return tokens;

        int i = 0;
        int n = text.length();
        while (i < n) {
            if (!isWordChar(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < n && isWordChar(text.charAt(i))) i++;
            tokens.add(Token.builder().word(text.substring(start, i)).start(start).end(i).build());
        }
        return tokens;
    }

    /**
     * 所有词边界偏移的集合。
     */
    public Set<Integer> boundaries(String text) {
        Set<Integer> result = new TreeSet<>();
        for (Token token : parse(text)) {
            result.add(token.getStart());
            result.add(token.getEnd());
        }
        return result;
    }

    /**
     * 在 text 中查找 label 的整词出现位置（从左到右、互不重叠）。
     * label 首尾若为词字符，则对应位置必须落在词边界上："Art" 不会匹配 "Article"。
     */
    public List<int[]> findWholeWord(String text, String label) {
        List<int[]> spans = new ArrayList<>();
        if (text == null || label == null || label.isEmpty()) return spans;

        Set<Integer> bounds = boundaries(text);
        boolean checkStart = isWordChar(label.charAt(0));
        boolean checkEnd = isWordChar(label.charAt(label.length() - 1));

        int from = 0;
        while (true) {
            int idx = text.indexOf(label, from);
            if (idx < 0) break;
            int end = idx + label.length();
            if ((!checkStart || bounds.contains(idx)) && (!checkEnd || bounds.contains(end))) {
                spans.add(new int[]{idx, end});
                from = end;
            } else {
                from = idx + 1;
            }
        }
        return spans;
    }
}
