package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.AstBuilder;
import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.Nodes;
import de.upb.sse.reorg.command.CommandState;
import de.upb.sse.reorg.command.Session;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;
import de.upb.sse.reorg.stats.ReorganizationStats;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything the stages of one reorganization share. A fresh context is
 * created per invocation and handed from stage to stage.
 */
public class ReorganizeContext {
    @Getter private final ReorganizerConfiguration config;
    @Getter private final CommandState commandState;
    @Getter private final Session session;
    @Getter private final ReorganizationStats stats;
    @Getter private final AstBuilder builder;
    @Getter private final ItemEquivalence equivalence;
    final HeaderAttributes headers;

    /** Snapshot of every item by id, so lookups do not need to search the tree. */
    private final Map<NodeId, Item> itemMap = new HashMap<>();

    /** Item to be moved -> destination module. */
    private final Map<NodeId, NodeId> itemToDestModule = new LinkedHashMap<>();

    /** Modules that have to be created, by name, e.g. "stdlib" -> id. */
    private final Map<String, NodeId> newModules = new LinkedHashMap<>();

    /** Existing modules items may be moved into, ordered by id. */
    private final SortedSet<NodeId> possibleDestinationModules = new TreeSet<>();

    /** Import id -> rewritten path and destination module. */
    private final Map<NodeId, PathRecord> pathMapping = new LinkedHashMap<>();

    private Map<NodeId, List<NodeId>> destModToItems = Collections.emptyMap();

    public ReorganizeContext(ReorganizerConfiguration config, CommandState st, Session session,
                             ReorganizationStats stats) {
        this.config = config;
        this.commandState = st;
        this.session = session;
        this.stats = stats;
        this.builder = new AstBuilder(st::nextNodeId);
        this.equivalence = new ItemEquivalence(config.getRelativeSegments());
        this.headers = new HeaderAttributes(config);
        newModules.put(config.getStdlibModuleName(), st.nextNodeId());
    }

    /** Rebuilds the item snapshot from {@code krate}, dropping previous entries. */
    public void catalog(Crate krate) {
        itemMap.clear();
        Nodes.visitNodes(krate, item -> itemMap.put(item.getId(), item));
    }

    public Optional<Item> lookup(NodeId id) {
        return Optional.ofNullable(itemMap.get(id));
    }

    public int catalogSize() {
        return itemMap.size();
    }

    void addPossibleDestination(NodeId moduleId) {
        possibleDestinationModules.add(moduleId);
    }

    public SortedSet<NodeId> getPossibleDestinationModules() {
        return Collections.unmodifiableSortedSet(possibleDestinationModules);
    }

    void addPathRecord(NodeId useId, PathRecord record) {
        pathMapping.put(useId, record);
    }

    public Optional<PathRecord> pathRecord(NodeId useId) {
        return Optional.ofNullable(pathMapping.get(useId));
    }

    Iterable<PathRecord> pathRecords() {
        return pathMapping.values();
    }

    boolean hasDestination(NodeId itemId) {
        return itemToDestModule.containsKey(itemId);
    }

    void assignDestination(NodeId itemId, NodeId moduleId) {
        itemToDestModule.put(itemId, moduleId);
    }

    public Optional<NodeId> destinationOf(NodeId itemId) {
        return Optional.ofNullable(itemToDestModule.get(itemId));
    }

    public NodeId stdlibModuleId() {
        return newModules.get(config.getStdlibModuleName());
    }

    /** The id of the module to create for {@code name}, minted on first request. */
    NodeId newModuleId(String name) {
        return newModules.computeIfAbsent(name, n -> commandState.nextNodeId());
    }

    /** Name of a module that is created by the reorganizer, if {@code id} is one. */
    Optional<String> newModuleName(NodeId id) {
        for (Map.Entry<String, NodeId> e : newModules.entrySet()) {
            if (e.getValue().equals(id)) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Inverts the item -> destination map. Items keep the order they were
     * assigned in; destinations are ordered by id.
     */
    Map<NodeId, List<NodeId>> createDestModMap() {
        Map<NodeId, List<NodeId>> result = new TreeMap<>();
        for (Map.Entry<NodeId, NodeId> e : itemToDestModule.entrySet()) {
            result.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
        }
        return result;
    }

    Map<NodeId, List<NodeId>> getDestModToItems() {
        return destModToItems;
    }

    void setDestModToItems(Map<NodeId, List<NodeId>> destModToItems) {
        this.destModToItems = Collections.unmodifiableMap(destModToItems);
    }
}
