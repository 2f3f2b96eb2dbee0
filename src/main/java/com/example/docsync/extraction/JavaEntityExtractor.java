package com.example.docsync.extraction;

import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.EntityKind;
import com.example.docsync.model.SourceUnit;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * AST-based extractor for Java sources.
 * Types (classes, interfaces, enums, records) become CLASS entities and method declarations
 * become METHOD entities. Units that do not parse are handed to the fallback extractor.
 */
public final class JavaEntityExtractor implements EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(JavaEntityExtractor.class);

    private final EntityExtractor fallback;

    public JavaEntityExtractor(EntityExtractor fallback) {
        this.fallback = fallback;
    }

    @Override
    public boolean supports(SourceUnit unit) {
        return unit.hasExtension(".java");
    }

    @Override
    public Set<CodeEntity> extract(SourceUnit unit) {
        if (unit.text().isBlank()) return Set.of();

        // JavaParser instances keep per-parse state: one per call
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(unit.text());
        } catch (StackOverflowError e) {
            log.warn("JavaEntityExtractor: '{}' nests too deeply to parse, using lexical fallback", unit.origin());
            return fallback.extract(unit);
        }
        Optional<CompilationUnit> compilationUnit = result.getResult();

        if (!result.isSuccessful() || compilationUnit.isEmpty()) {
            log.debug("JavaEntityExtractor: '{}' does not parse ({} problem(s)), using lexical fallback",
                    unit.origin(), result.getProblems().size());
            return fallback.extract(unit);
        }

        Map<String, CodeEntity> byName = new LinkedHashMap<>();
        try {
            collect(compilationUnit.get(), unit.origin(), byName);
        } catch (StackOverflowError e) {
            log.warn("JavaEntityExtractor: '{}' nests too deeply to walk, using lexical fallback", unit.origin());
            return fallback.extract(unit);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(byName.values()));
    }

    private static void collect(CompilationUnit compilationUnit, String origin, Map<String, CodeEntity> byName) {
        compilationUnit.accept(new VoidVisitorAdapter<Void>() {
            @Override
            public void visit(ClassOrInterfaceDeclaration cid, Void arg) {
                add(byName, cid.getNameAsString(), EntityKind.CLASS, origin);
                super.visit(cid, arg);
            }

            @Override
            public void visit(EnumDeclaration ed, Void arg) {
                add(byName, ed.getNameAsString(), EntityKind.CLASS, origin);
                super.visit(ed, arg);
            }

            @Override
            public void visit(RecordDeclaration rd, Void arg) {
                add(byName, rd.getNameAsString(), EntityKind.CLASS, origin);
                super.visit(rd, arg);
            }

            @Override
            public void visit(MethodDeclaration md, Void arg) {
                add(byName, md.getNameAsString(), EntityKind.METHOD, origin);
                super.visit(md, arg);
            }
        }, null);
    }

    private static void add(Map<String, CodeEntity> byName, String name, EntityKind kind, String origin) {
        if (name.length() < LexicalEntityExtractor.MIN_NAME_LENGTH) return;
        byName.putIfAbsent(name, new CodeEntity(name, kind, origin));
    }
}
