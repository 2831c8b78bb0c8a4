package com.webcrawler.core.crawler;

import com.webcrawler.core.model.PageLink;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 기본 JSoup 기반 링크 추출기: a[href] → {href 원문, 링크 텍스트} */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<PageLink> extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) return List.of();
        Document doc = (pageUrl == null) ? Jsoup.parse(html) : Jsoup.parse(html, pageUrl);
        return extract(doc);
    }

    /** 이미 파싱된 문서 재사용(페처가 title과 함께 한 번만 파싱) */
    public List<PageLink> extract(Document doc) {
        List<PageLink> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (href == null || href.isBlank()) continue;
            out.add(new PageLink(href.trim(), a.text().trim()));
        }
        return out;
    }
}
