package com.raditha.mwp.frontend;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses C function definitions written in the subset of C that is also valid
 * inside a Java class body.
 * <p>
 * Preprocessor lines are blanked and the text is wrapped in a synthetic class,
 * keeping line numbers aligned with the original file.
 */
public class SourceParser {

    static final String WRAPPER_CLASS = "MwpProgram";

    private SourceParser() {
    }

    public static CompilationUnit parse(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parse source text.
     *
     * @throws IllegalArgumentException if the text is not in the supported subset
     */
    public static CompilationUnit parse(String source) {
        String wrapped = "class " + WRAPPER_CLASS + " { " + stripPreprocessor(source) + "\n}";
        try {
            return StaticJavaParser.parse(wrapped);
        } catch (ParseProblemException e) {
            throw new IllegalArgumentException("Cannot parse source: " + e.getProblems(), e);
        }
    }

    /**
     * Function definitions in source order.
     */
    public static List<MethodDeclaration> functions(CompilationUnit cu) {
        return cu.findAll(MethodDeclaration.class);
    }

    static String stripPreprocessor(String source) {
        StringBuilder sb = new StringBuilder(source.length());
        for (String line : source.split("\n", -1)) {
            if (!line.stripLeading().startsWith("#")) {
                sb.append(line);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
