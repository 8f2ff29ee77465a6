package org.tova.compiler.frontend.parser.block;

import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.features.cli.CliBlockHandler;
import org.tova.compiler.frontend.parser.features.client.ClientBlockHandler;
import org.tova.compiler.frontend.parser.features.deploy.DeployBlockHandler;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockHandler;
import org.tova.compiler.frontend.parser.features.security.SecurityBlockHandler;
import org.tova.compiler.frontend.parser.features.server.ServerBlockHandler;
import org.tova.compiler.frontend.parser.features.shared.SharedBlockHandler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for top-level block handlers. Handlers are asked in registration order
 * whether they recognize the tokens at the cursor; the first match parses the block.
 */
public class BlockHandlerRegistry {
    private final Map<String, IBlockHandler> handlers = new LinkedHashMap<>();

    /**
     * Registers a new block handler.
     * @param blockName The name of the block (e.g., "server").
     * @param handler The handler for the block.
     */
    public void register(String blockName, IBlockHandler handler) {
        handlers.put(blockName.toLowerCase(), handler);
    }

    /**
     * Gets the handler for a given block name.
     * @param blockName The name of the block.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IBlockHandler> get(String blockName) {
        return Optional.ofNullable(handlers.get(blockName.toLowerCase()));
    }

    /**
     * Finds the first handler whose detection strategy accepts the cursor position.
     * @param context The parsing context; detection must not move the cursor.
     * @return The matching handler, or empty for an ordinary statement.
     */
    public Optional<IBlockHandler> find(ParsingContext context) {
        for (IBlockHandler handler : handlers.values()) {
            if (handler.detect(context)) return Optional.of(handler);
        }
        return Optional.empty();
    }

    /**
     * @return The registered block names in registration order.
     */
    public Iterable<String> names() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Initializes the registry with all built-in block handlers.
     * @return A new instance of {@link BlockHandlerRegistry} with all handlers registered.
     */
    public static BlockHandlerRegistry initialize() {
        BlockHandlerRegistry registry = new BlockHandlerRegistry();
        registry.register("client", new ClientBlockHandler());
        registry.register("server", new ServerBlockHandler());
        registry.register("shared", new SharedBlockHandler());
        registry.register("edge", new EdgeBlockHandler());
        registry.register("deploy", new DeployBlockHandler());
        registry.register("security", new SecurityBlockHandler());
        registry.register("cli", new CliBlockHandler());
        return registry;
    }
}
