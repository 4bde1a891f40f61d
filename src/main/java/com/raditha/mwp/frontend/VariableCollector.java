package com.raditha.mwp.frontend;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects variable names, sorted and unique.
 */
public class VariableCollector {

    private VariableCollector() {
    }

    /**
     * Parameters, declared locals and every identifier of a function.
     */
    public static List<String> collect(MethodDeclaration method) {
        Set<String> names = new TreeSet<>();
        for (Parameter p : method.getParameters()) {
            names.add(p.getNameAsString());
        }
        method.getBody().ifPresent(body -> names.addAll(collect(body)));
        return List.copyOf(names);
    }

    /**
     * Declared variables and identifiers within a node.
     */
    public static Set<String> collect(Node node) {
        Set<String> names = new TreeSet<>();
        node.findAll(VariableDeclarator.class).forEach(v -> names.add(v.getNameAsString()));
        node.findAll(NameExpr.class).forEach(n -> names.add(n.getNameAsString()));
        return names;
    }
}
