package com.vidnyan.quyaml.domain.lowering;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks open control blocks during lowering so every begin has exactly one
 * matching end, and if-branches advance then, elif..., else in order.
 */
final class ScopeStack {

    enum BlockKind { IF, WHILE, FOR }

    enum Branch { THEN, ELIF, ELSE, BODY }

    private static final class Scope {
        final BlockKind kind;
        final String path;
        Branch branch;

        Scope(BlockKind kind, String path, Branch branch) {
            this.kind = kind;
            this.path = path;
            this.branch = branch;
        }
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();
    private int maxDepth;

    void open(BlockKind kind, String path) {
        scopes.push(new Scope(kind, path, kind == BlockKind.IF ? Branch.THEN : Branch.BODY));
        maxDepth = Math.max(maxDepth, scopes.size());
    }

    void enterElif(String path) {
        Scope top = requireTop(BlockKind.IF, path);
        if (top.branch == Branch.ELSE) {
            throw QuyamlException.at(ErrorKind.LOWERING, path, "elif after else in if-block opened at " + top.path);
        }
        top.branch = Branch.ELIF;
    }

    void enterElse(String path) {
        Scope top = requireTop(BlockKind.IF, path);
        if (top.branch == Branch.ELSE) {
            throw QuyamlException.at(ErrorKind.LOWERING, path, "second else in if-block opened at " + top.path);
        }
        top.branch = Branch.ELSE;
    }

    void close(BlockKind kind, String path) {
        requireTop(kind, path);
        scopes.pop();
    }

    /**
     * Fails when any block is still open.
     */
    void verifyEmpty() {
        if (!scopes.isEmpty()) {
            Scope top = scopes.peek();
            throw QuyamlException.at(ErrorKind.LOWERING, top.path,
                    scopes.size() + " control block(s) left open, innermost " + top.kind);
        }
    }

    int depth() {
        return scopes.size();
    }

    int maxDepth() {
        return maxDepth;
    }

    private Scope requireTop(BlockKind kind, String path) {
        Scope top = scopes.peek();
        if (top == null || top.kind != kind) {
            throw QuyamlException.at(ErrorKind.LOWERING, path,
                    "expected open " + kind + " block but found " + (top == null ? "none" : top.kind));
        }
        return top;
    }
}
