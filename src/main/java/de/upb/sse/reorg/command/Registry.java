package de.upb.sse.reorg.command;

import de.upb.sse.reorg.exceptions.UnknownCommandException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Maps command names to transform factories.
 */
public class Registry {
    private static final Logger logger = Logger.getLogger(Registry.class.getName());

    private final Map<String, Supplier<? extends Transform>> commands = new TreeMap<>();

    public void register(String name, Supplier<? extends Transform> factory) {
        if (commands.put(name, factory) != null) {
            logger.warning("Command " + name + " registered twice, keeping the last registration");
        }
    }

    public boolean contains(String name) {
        return commands.containsKey(name);
    }

    public Transform get(String name) {
        Supplier<? extends Transform> factory = commands.get(name);
        if (factory == null) {
            throw new UnknownCommandException(name, commands.keySet());
        }
        return factory.get();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
