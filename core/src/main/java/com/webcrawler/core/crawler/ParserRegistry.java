package com.webcrawler.core.crawler;

import com.webcrawler.core.api.IPageParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 페이지 host에 맞는 파서 선택. 생성 후 읽기 전용이라 워커 간 공유에 잠금이 필요 없다.
 * 순서: 정확한 host 매핑 → 규칙(priority 내림차순, 동률은 등록 순) → 기본 파서 → 없음
 */
public final class ParserRegistry {

    private final Map<String, IPageParser> byHost;
    private final List<ParserRule> rules;
    private final IPageParser defaultParser;

    public ParserRegistry(Map<String, IPageParser> byHost, List<ParserRule> rules, IPageParser defaultParser) {
        this.byHost = Map.copyOf(byHost == null ? Map.of() : new LinkedHashMap<>(byHost));
        List<ParserRule> sorted = new ArrayList<>(rules == null ? List.of() : rules);
        sorted.sort(Comparator.comparingInt(ParserRule::getPriority).reversed()); // stable
        this.rules = List.copyOf(sorted);
        this.defaultParser = defaultParser;
    }

    public static ParserRegistry empty() {
        return new ParserRegistry(Map.of(), List.of(), null);
    }

    /** @return 선택된 파서, 없으면 null */
    public IPageParser select(String host) {
        if (host != null) {
            IPageParser p = byHost.get(host);
            if (p != null) return p;
            for (ParserRule r : rules) {
                if (r.matches(host)) return r.getParser();
            }
        }
        return defaultParser;
    }

    public boolean isEmpty() {
        return byHost.isEmpty() && rules.isEmpty() && defaultParser == null;
    }

    List<ParserRule> rules() { return rules; }
}
