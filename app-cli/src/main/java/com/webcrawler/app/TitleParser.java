package com.webcrawler.app;

import com.webcrawler.core.api.IPageParser;
import com.webcrawler.core.model.FetchResponse;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/** 기본 파서: title, 첫 h1, 링크 수 → JSONL "parsed" 필드 */
public final class TitleParser implements IPageParser {

    @Override
    public Map<String, Object> parse(FetchResponse response) {
        Document doc = Jsoup.parse(response.getHtml(), response.getUrl() == null ? "" : response.getUrl());
        Element h1 = doc.selectFirst("h1");

        Map<String, Object> out = new LinkedHashMap<>();
        String title = response.getTitle().isEmpty() ? doc.title() : response.getTitle();
        out.put("title", title);
        out.put("h1", h1 == null ? null : h1.text());
        out.put("links", response.getLinks() != null ? response.getLinks().size() : doc.select("a[href]").size());
        return out;
    }
}
