package com.eyelevel.documentindexer.service.convert.impl;

import com.eyelevel.documentindexer.service.convert.TextExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
public class HtmlTextExtractor implements TextExtractor {

    @Override
    public boolean supports(String mimeType) {
        return "text/html".equals(mimeType);
    }

    @Override
    public String extract(byte[] content) {
        Document document = Jsoup.parse(new String(content, StandardCharsets.UTF_8));
        return document.text();
    }
}
