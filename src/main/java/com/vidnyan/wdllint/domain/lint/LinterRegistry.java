package com.vidnyan.wdllint.domain.lint;

import com.vidnyan.wdllint.domain.lint.rules.ArrayCoercion;
import com.vidnyan.wdllint.domain.lint.rules.CommandShellCheck;
import com.vidnyan.wdllint.domain.lint.rules.FileCoercion;
import com.vidnyan.wdllint.domain.lint.rules.ForwardReference;
import com.vidnyan.wdllint.domain.lint.rules.IncompleteCall;
import com.vidnyan.wdllint.domain.lint.rules.MixedIndentation;
import com.vidnyan.wdllint.domain.lint.rules.NameCollision;
import com.vidnyan.wdllint.domain.lint.rules.NonemptyCoercion;
import com.vidnyan.wdllint.domain.lint.rules.OptionalCoercion;
import com.vidnyan.wdllint.domain.lint.rules.SelectArray;
import com.vidnyan.wdllint.domain.lint.rules.StringCoercion;
import com.vidnyan.wdllint.domain.lint.rules.UnknownRuntimeKey;
import com.vidnyan.wdllint.domain.lint.rules.UnnecessaryQuantifier;
import com.vidnyan.wdllint.domain.lint.rules.UnusedCall;
import com.vidnyan.wdllint.domain.lint.rules.UnusedDeclaration;
import com.vidnyan.wdllint.domain.lint.rules.UnusedImport;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, immutable set of lint rules to run. Rule order determines the order of
 * diagnostics attached to the same node.
 */
public final class LinterRegistry {

    /**
     * A registered rule: its name and how to instantiate it.
     */
    public record Entry(String name, LinterFactory factory) {
    }

    private final List<Entry> entries;

    private LinterRegistry(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * All built-in rules.
     */
    public static LinterRegistry defaults() {
        return new LinterRegistry(List.of(
                entry(StringCoercion.class, StringCoercion::new),
                entry(FileCoercion.class, FileCoercion::new),
                entry(ArrayCoercion.class, ArrayCoercion::new),
                entry(OptionalCoercion.class, OptionalCoercion::new),
                entry(NonemptyCoercion.class, NonemptyCoercion::new),
                entry(IncompleteCall.class, IncompleteCall::new),
                entry(NameCollision.class, NameCollision::new),
                entry(UnusedImport.class, UnusedImport::new),
                entry(ForwardReference.class, ForwardReference::new),
                entry(UnusedDeclaration.class, UnusedDeclaration::new),
                entry(UnusedCall.class, UnusedCall::new),
                entry(UnnecessaryQuantifier.class, UnnecessaryQuantifier::new),
                entry(CommandShellCheck.class, CommandShellCheck::new),
                entry(MixedIndentation.class, MixedIndentation::new),
                entry(SelectArray.class, SelectArray::new),
                entry(UnknownRuntimeKey.class, UnknownRuntimeKey::new)
        ));
    }

    public static LinterRegistry of(List<Entry> entries) {
        return new LinterRegistry(entries);
    }

    public static Entry entry(Class<? extends Linter> type, LinterFactory factory) {
        return new Entry(type.getSimpleName(), factory);
    }

    /**
     * A registry without the named rules.
     *
     * @throws IllegalArgumentException if a name matches no registered rule
     */
    public LinterRegistry without(Collection<String> names) {
        Set<String> known = names();
        for (String name : names) {
            if (!known.contains(name)) {
                throw new IllegalArgumentException("Unknown lint rule: " + name + " (known: " + known + ")");
            }
        }
        return new LinterRegistry(entries.stream()
                .filter(e -> !names.contains(e.name()))
                .toList());
    }

    public List<Entry> entries() {
        return entries;
    }

    public Set<String> names() {
        return entries.stream()
                .map(Entry::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return entries.size();
    }
}
