package com.gdin.inspection.lodbook.doc.tokenizer;

import com.gdin.inspection.lodbook.pojo.Token;

import java.util.List;

public interface ITokenizer {

    List<Token> parse(String text);
}
