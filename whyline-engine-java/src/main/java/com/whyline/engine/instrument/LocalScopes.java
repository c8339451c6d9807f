package com.whyline.engine.instrument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Block-structured view of the locals declared so far, tracking which of them are
 * definitely assigned at the current point. Only those may be named in a frame binding,
 * otherwise the instrumented source would not compile.
 *
 * Method bodies, lambdas and initializers are barriers: locals of the enclosing code are
 * not visible past them.
 */
final class LocalScopes {

    private static final class Scope {
        final boolean barrier;
        final Map<String, Boolean> declared = new LinkedHashMap<>();
        final Set<String> assignedHere = new HashSet<>();

        Scope(boolean barrier) {
            this.barrier = barrier;
        }
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    void push() {
        scopes.push(new Scope(false));
    }

    void pushBarrier() {
        scopes.push(new Scope(true));
    }

    void pop() {
        scopes.pop();
    }

    void declare(String name, boolean assigned) {
        if (scopes.isEmpty()) return;
        scopes.peek().declared.put(name, assigned);
    }

    /** Records that {@code name} is assigned from here until the current scope closes. */
    void markAssigned(String name) {
        if (scopes.isEmpty()) return;
        for (Scope scope : scopes) {
            Boolean assigned = scope.declared.get(name);
            if (assigned != null) {
                if (!assigned) scopes.peek().assignedHere.add(name);
                return;
            }
            if (scope.barrier) return;
        }
    }

    /** A new switch label: assignments made under earlier labels do not reach it. */
    void enterSwitchLabel() {
        if (scopes.isEmpty()) return;
        Scope current = scopes.peek();
        current.declared.replaceAll((name, assigned) -> false);
        current.assignedHere.clear();
    }

    /** Definitely assigned locals, outermost declaration first. */
    List<String> visible() {
        List<List<String>> perScope = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> assignedInner = new HashSet<>();
        Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            Scope scope = it.next();
            assignedInner.addAll(scope.assignedHere);
            List<String> names = new ArrayList<>();
            for (Map.Entry<String, Boolean> entry : scope.declared.entrySet()) {
                String name = entry.getKey();
                if (seen.add(name) && (entry.getValue() || assignedInner.contains(name))) {
                    names.add(name);
                }
            }
            perScope.add(names);
            if (scope.barrier) break;
        }
        Collections.reverse(perScope);
        Set<String> out = new LinkedHashSet<>();
        perScope.forEach(out::addAll);
        return new ArrayList<>(out);
    }
}
