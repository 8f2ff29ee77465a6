package org.tova.compiler.backend.targets;

import java.util.ArrayList;
import java.util.List;

/**
 * The emitted pieces of one target file. The shared code is spliced in between the header and the
 * body once the runtime prelude is known.
 *
 * @param header Imports and other lines that must come first.
 * @param body The target's own code.
 */
public record TargetCode(String header, String body) {

    /**
     * @param shared The shared code including the runtime prelude, may be empty.
     * @return The complete file.
     */
    public String assemble(String shared) {
        List<String> parts = new ArrayList<>();
        if (!header.isBlank()) parts.add(header);
        if (!shared.isBlank()) parts.add("// ── Shared ──\n" + shared);
        if (!body.isBlank()) parts.add(body);
        return String.join("\n\n", parts);
    }
}
