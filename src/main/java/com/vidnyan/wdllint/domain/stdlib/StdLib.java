package com.vidnyan.wdllint.domain.stdlib;

import com.vidnyan.wdllint.domain.model.type.WdlType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vidnyan.wdllint.domain.model.type.Types.array;
import static com.vidnyan.wdllint.domain.model.type.Types.bool;
import static com.vidnyan.wdllint.domain.model.type.Types.file;
import static com.vidnyan.wdllint.domain.model.type.Types.floating;
import static com.vidnyan.wdllint.domain.model.type.Types.integer;
import static com.vidnyan.wdllint.domain.model.type.Types.map;
import static com.vidnyan.wdllint.domain.model.type.Types.optional;
import static com.vidnyan.wdllint.domain.model.type.Types.string;

/**
 * Catalog of standard library functions with static signatures.
 * <p>
 * Polymorphic functions ({@code length}, {@code select_first}, {@code size}, {@code defined},
 * ...) and infix operators are resolved case by case by the type checker and have no entry.
 */
public final class StdLib {

    private static final Map<String, StaticFunction> FUNCTIONS = new LinkedHashMap<>();

    static {
        register("floor", integer(), floating());
        register("ceil", integer(), floating());
        register("round", integer(), floating());
        register("stdout", file());
        register("stderr", file());
        register("glob", array(file()), string());
        register("basename", string(), string(), optional(string()));
        register("sub", string(), string(), string(), string());
        register("read_int", integer(), file());
        register("read_boolean", bool(), file());
        register("read_float", floating(), file());
        register("read_string", string(), file());
        register("read_lines", array(string()), file());
        register("read_tsv", array(array(string())), file());
        register("read_map", map(string(), string()), file());
        register("write_lines", file(), array(string()));
        register("write_tsv", file(), array(array(string())));
        register("write_map", file(), map(string(), string()));
        register("range", array(integer()), integer());
        register("prefix", array(string()), string(), array(string()));
    }

    private StdLib() {
    }

    private static void register(String name, WdlType returnType, WdlType... argumentTypes) {
        FUNCTIONS.put(name, new StaticFunction(name, List.of(argumentTypes), returnType));
    }

    /**
     * The static signature of {@code name}, if it has one.
     */
    public static Optional<StaticFunction> staticFunction(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }
}
