package com.example.docsync.extraction;

import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.EntityKind;
import com.example.docsync.model.SourceUnit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort, language-agnostic entity scanner based on regular expressions.
 * <p>
 * Patterns are applied in order and the first pattern matching a name decides its kind.
 * Over-inclusive: a false positive shows up as an undocumented entity.
 */
public final class LexicalEntityExtractor implements EntityExtractor {

    /** Matches of this length or shorter are noise (loop variables, type hints). */
    static final int MIN_NAME_LENGTH = 3;

    /** Words that look like "key:" but are control flow or URL schemes. */
    private static final Set<String> RESERVED_KEYS = Set.of(
            "else", "try", "finally", "default", "case", "http", "https",
            "public", "private", "protected", "lambda"
    );

    private static final List<EntityPattern> DEFAULT_PATTERNS = List.of(
            // indented def: a method inside a Python class body
            new EntityPattern(EntityKind.METHOD,
                    Pattern.compile("(?m)^[ \\t]+(?:async[ \\t]+)?def\\s+([A-Za-z_]\\w*)")),
            new EntityPattern(EntityKind.FUNCTION,
                    Pattern.compile("\\bdef\\s+([A-Za-z_]\\w*)")),
            new EntityPattern(EntityKind.FUNCTION,
                    Pattern.compile("\\bfunction\\s+([A-Za-z_]\\w*)")),
            new EntityPattern(EntityKind.FUNCTION,
                    Pattern.compile("\\b(?:const|let|var)\\s+([A-Za-z_]\\w*)\\s*=\\s*(?:async\\s*)?(?:\\(.*\\)|function)")),
            new EntityPattern(EntityKind.FUNCTION,
                    Pattern.compile("\\b(?:fn|func)\\s+([A-Za-z_]\\w*)")),
            new EntityPattern(EntityKind.CLASS,
                    Pattern.compile("\\b(?:class|interface|struct|enum|trait)\\s+([A-Za-z_]\\w*)")),
            // C-family method declaration: modifiers, return type, name, parenthesis
            new EntityPattern(EntityKind.METHOD,
                    Pattern.compile("(?m)^[ \\t]*(?:(?:public|private|protected|internal|static|final|abstract"
                            + "|synchronized|override|virtual|async)\\s+)+[\\w<>\\[\\],.?]+\\s+([A-Za-z_]\\w*)\\s*\\(")),
            new EntityPattern(EntityKind.CONFIG_KEY,
                    Pattern.compile("(['\"]?[\\w-]+['\"]?)\\s*:"))
    );

    private final List<EntityPattern> patterns;

    public LexicalEntityExtractor() {
        this(DEFAULT_PATTERNS);
    }

    public LexicalEntityExtractor(List<EntityPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public boolean supports(SourceUnit unit) {
        return true;
    }

    @Override
    public Set<CodeEntity> extract(SourceUnit unit) {
        String text = unit.text();
        if (text.isBlank()) return Set.of();

        Map<String, CodeEntity> byName = new LinkedHashMap<>();
        for (EntityPattern pattern : patterns) {
            Matcher matcher = pattern.regex().matcher(text);
            while (matcher.find()) {
                String name = trimQuotes(matcher.group(1));
                if (name.length() < MIN_NAME_LENGTH) continue;
                if (pattern.kind() == EntityKind.CONFIG_KEY && RESERVED_KEYS.contains(name.toLowerCase())) continue;
                byName.putIfAbsent(name, new CodeEntity(name, pattern.kind(), unit.origin()));
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(byName.values()));
    }

    private static String trimQuotes(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && isQuote(raw.charAt(start))) start++;
        while (end > start && isQuote(raw.charAt(end - 1))) end--;
        return raw.substring(start, end).trim();
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    /**
     * One lexical rule: group 1 of {@code regex} is the entity name.
     */
    public record EntityPattern(EntityKind kind, Pattern regex) {}
}
