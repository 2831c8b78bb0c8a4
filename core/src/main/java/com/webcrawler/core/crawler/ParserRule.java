package com.webcrawler.core.crawler;

import com.webcrawler.core.api.IPageParser;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * host → 파서 매칭 규칙. priority가 높을수록 먼저 평가.
 * REGEX/GLOB 패턴은 생성 시 한 번 컴파일(잘못된 패턴은 즉시 IllegalArgumentException).
 */
public final class ParserRule {

    public enum MatchType {
        EXACT,   // host 완전 일치
        PREFIX,  // "blog." 으로 시작
        SUFFIX,  // ".example.com" 으로 끝
        GLOB,    // "*.example.com" (*, ? 지원, 전체 일치)
        REGEX    // 정규식(부분 일치)
    }

    private final String pattern;
    private final MatchType type;
    private final IPageParser parser;
    private final int priority;
    private final Pattern compiled; // REGEX/GLOB 전용

    private ParserRule(String pattern, MatchType type, IPageParser parser, int priority) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.type = Objects.requireNonNull(type, "type");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.priority = priority;
        this.compiled = compile(pattern, type);
    }

    public static ParserRule exact(String host, IPageParser parser, int priority) {
        return new ParserRule(host, MatchType.EXACT, parser, priority);
    }
    public static ParserRule prefix(String prefix, IPageParser parser, int priority) {
        return new ParserRule(prefix, MatchType.PREFIX, parser, priority);
    }
    public static ParserRule suffix(String suffix, IPageParser parser, int priority) {
        return new ParserRule(suffix, MatchType.SUFFIX, parser, priority);
    }
    public static ParserRule glob(String glob, IPageParser parser, int priority) {
        return new ParserRule(glob, MatchType.GLOB, parser, priority);
    }
    public static ParserRule regex(String regex, IPageParser parser, int priority) {
        return new ParserRule(regex, MatchType.REGEX, parser, priority);
    }

    public boolean matches(String host) {
        if (host == null) return false;
        return switch (type) {
            case EXACT -> host.equals(pattern);
            case PREFIX -> host.startsWith(pattern);
            case SUFFIX -> host.endsWith(pattern);
            case GLOB, REGEX -> compiled.matcher(host).find();
        };
    }

    public String getPattern() { return pattern; }
    public MatchType getType() { return type; }
    public IPageParser getParser() { return parser; }
    public int getPriority() { return priority; }

    private static Pattern compile(String pattern, MatchType type) {
        try {
            return switch (type) {
                case REGEX -> Pattern.compile(pattern);
                case GLOB -> Pattern.compile(globToRegex(pattern));
                default -> null;
            };
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid " + type + " pattern: " + pattern, e);
        }
    }

    /** "*.example.com" → "^.*\.example\.com$" */
    static String globToRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8).append('^');
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') sb.append(".*");
            else if (c == '?') sb.append('.');
            else if (Character.isLetterOrDigit(c)) sb.append(c);
            else sb.append('\\').append(c);
        }
        return sb.append('$').toString();
    }

    @Override
    public String toString() {
        return type + ":" + pattern + "(p=" + priority + ")";
    }
}
