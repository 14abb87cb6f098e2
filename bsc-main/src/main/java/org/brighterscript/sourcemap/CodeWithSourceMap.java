package org.brighterscript.sourcemap;

import java.util.List;

public record CodeWithSourceMap(String code, List<Mapping> mappings) {

    public CodeWithSourceMap {
        mappings = List.copyOf(mappings);
    }
}
