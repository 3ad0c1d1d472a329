package com.gridmodel.glm.manager;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.exception.DuplicateItemException;
import com.gridmodel.glm.exception.InvalidTypeException;
import com.gridmodel.glm.exception.InvalidValueException;
import com.gridmodel.glm.exception.ItemNotFoundException;
import com.gridmodel.glm.index.IndexEntry;
import com.gridmodel.glm.index.ModelIndex;
import com.gridmodel.glm.index.ModelIndexBuilder;
import com.gridmodel.glm.model.ClockItem;
import com.gridmodel.glm.model.DirectiveItem;
import com.gridmodel.glm.model.FieldedItem;
import com.gridmodel.glm.model.GlmItem;
import com.gridmodel.glm.model.GlmItemFactory;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ModuleItem;
import com.gridmodel.glm.model.ObjectItem;
import com.gridmodel.glm.parser.GlmParser;
import com.gridmodel.glm.storage.ModelStorage;
import com.gridmodel.glm.writer.GlmSerializer;
import com.gridmodel.glm.writer.RenderedModel;

/**
 * Manages one GLM model: add, modify and remove items, query objects and
 * modules, and prepare the model for a simulation run.
 *
 * The manager owns a {@link ModelTree} and the {@link ModelIndex} built from
 * it. Every operation validates its input before touching either, then
 * updates both, so a failed call leaves the model exactly as it was.
 *
 * New objects are appended after every existing key; clocks, modules and
 * directives are prepended before every existing key, keeping the preamble
 * ahead of the devices in the written model.
 *
 * Not thread-safe: one writer at a time.
 */
public class GlmModelManager {
    private static final Logger log = LoggerFactory.getLogger(GlmModelManager.class);

    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String POWERFLOW = "powerflow";
    static final String GENERATORS = "generators";
    static final String VSOURCE = "VSOURCE";
    static final String MINIMUM_TIMESTEP = "minimum_timestep";
    static final String PROFILER = "profiler";
    static final String RELAX_NAMING_RULES = "relax_naming_rules";

    private final GlmModelConfig config;
    private final ModelTree tree;
    private final ModelIndex index;
    private final ToolDiagnostics loadDiagnostics;
    private final ModelIndexBuilder indexBuilder = new ModelIndexBuilder();
    private final GlmSerializer serializer;
    private final DistributedGenerationDetector generationDetector;

    private int appendKey;
    private int prependKey;

    public GlmModelManager(String modelText) {
        this(modelText, GlmModelConfig.defaults());
    }

    public GlmModelManager(String modelText, GlmModelConfig config) {
        this.config = config;
        this.loadDiagnostics = new ToolDiagnostics();
        this.tree = GlmParser.parseText(modelText, config, loadDiagnostics);
        this.index = indexBuilder.build(tree);
        this.serializer = new GlmSerializer(config);
        this.generationDetector = new DistributedGenerationDetector(config.getDistributedGenerationTypes());

        this.appendKey = tree.lastKey() + 1;
        this.prependKey = tree.firstKey() - 1;

        log.debug("Model loaded: {} items, keys [{}, {}]", tree.size(), tree.firstKey(), tree.lastKey());
    }

    /**
     * Reads and parses a model through the given storage.
     */
    public static GlmModelManager load(Path path, ModelStorage storage, GlmModelConfig config) throws IOException {
        String text = storage.read(path);
        GlmModelManager manager = new GlmModelManager(text, config);
        log.info("Loaded model {} ({} items)", path, manager.tree.size());
        return manager;
    }

    public ModelTree getTree() {
        return tree;
    }

    public ModelIndex getIndex() {
        return index;
    }

    public ToolDiagnostics getLoadDiagnostics() {
        return loadDiagnostics;
    }

    public GlmModelConfig getConfig() {
        return config;
    }

    /** Key the next appended object will get. */
    public int getAppendKey() {
        return appendKey;
    }

    /** Key the next prepended clock, module or directive will get. */
    public int getPrependKey() {
        return prependKey;
    }

    // ---- Adding ----

    public void addItem(Map<String, ?> properties) {
        addItem(GlmItemFactory.fromProperties(properties));
    }

    /**
     * Adds a new item. Objects go to the end of the model, everything else
     * to the front.
     *
     * @throws DuplicateItemException for a second clock, an existing module
     *         name, or an existing (type, name) object
     * @throws InvalidTypeException for item kinds that cannot be added
     */
    public void addItem(GlmItem item) {
        if (item == null) {
            throw new InvalidTypeException("Item must not be null");
        }

        if (item instanceof ObjectItem object) {
            if (object.getType() == null || object.getType().isBlank()) {
                throw new InvalidTypeException("Object items need a type");
            }
            index.checkObjectAddable(object);
            int key = appendKey++;
            tree.put(key, object);
            index.putObject(key, object);
            log.debug("Appended {} at key {}", object.describe(), key);
        } else if (item instanceof ClockItem clock) {
            if (index.getClock().isPresent()) {
                throw new DuplicateItemException("Model already has a clock");
            }
            int key = prependKey--;
            tree.put(key, clock);
            index.putClock(key, clock);
            log.debug("Prepended clock at key {}", key);
        } else if (item instanceof ModuleItem module) {
            requireNewModule(module.getName());
            int key = prependKey--;
            tree.put(key, module);
            index.putModule(module.getName(), key, module);
            log.debug("Prepended {} at key {}", module.describe(), key);
        } else if (item instanceof DirectiveItem directive) {
            if (directive.isModuleDeclaration()) {
                requireNewModule(directive.getArgument());
            }
            int key = prependKey--;
            tree.put(key, directive);
            if (directive.isModuleDeclaration()) {
                index.putModule(directive.getArgument(), key, directive);
            }
            log.debug("Prepended {} at key {}", directive.describe(), key);
        } else {
            throw new InvalidTypeException("No add method for item type " + item.getClass().getSimpleName());
        }
    }

    private void requireNewModule(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidTypeException("Module items need a name");
        }
        if (index.hasModule(name)) {
            throw new DuplicateItemException("Module " + name + " is already present");
        }
    }

    // ---- Modifying ----

    public FieldedItem modifyItem(Map<String, ?> properties) {
        return modifyItem(GlmItemFactory.fromProperties(properties));
    }

    /**
     * Overwrites (or adds) the fields given in {@code update} on the matching
     * existing item. Objects are matched by type and name, modules by name;
     * the name itself cannot be changed this way.
     *
     * @return the modified item, which is the instance held by the tree
     */
    public FieldedItem modifyItem(GlmItem update) {
        FieldedItem target;
        Map<String, String> changes;

        if (update instanceof ObjectItem object) {
            target = lookupObject(object);
            changes = new LinkedHashMap<>(object.getFields());
            changes.remove(ObjectItem.NAME);
        } else if (update instanceof ClockItem clock) {
            target = lookupClock();
            changes = clock.getFields();
        } else if (update instanceof ModuleItem module) {
            target = moduleForUpdate(module.getName());
            changes = module.getFields();
        } else {
            throw new InvalidTypeException("Cannot modify item of type "
                    + (update == null ? "null" : update.getClass().getSimpleName()));
        }

        target.getFields().putAll(changes);
        log.debug("Modified {}: {}", target.describe(), changes.keySet());
        return target;
    }

    /**
     * Returns the block module with the given name, first turning a
     * {@code module <name>;} declaration into a block at the same key.
     */
    private ModuleItem moduleForUpdate(String name) {
        IndexEntry<GlmItem> entry = lookupModuleEntry(name);
        if (entry.getItem() instanceof ModuleItem module) {
            return module;
        }

        ModuleItem module = ModuleItem.builder()
                .name(name)
                .sourceLine(entry.getItem().getSourceLine())
                .build();
        tree.put(entry.getKey(), module);
        index.replaceModule(name, entry.getKey(), module);
        log.debug("Converted module declaration {} to a block", name);
        return module;
    }

    // ---- Removing ----

    public void removePropertiesFromItem(Map<String, ?> properties, Collection<String> fieldNames) {
        removePropertiesFromItem(GlmItemFactory.fromProperties(properties), fieldNames);
    }

    /**
     * Removes the named fields from the matching item. Either every field is
     * removed or, if one is missing, none is.
     *
     * @throws ItemNotFoundException if the item or any of the fields does not exist
     */
    public void removePropertiesFromItem(GlmItem item, Collection<String> fieldNames) {
        GlmItem target;
        if (item instanceof ObjectItem object) {
            target = lookupObject(object);
        } else if (item instanceof ClockItem) {
            target = lookupClock();
        } else if (item instanceof ModuleItem module) {
            target = lookupModuleEntry(module.getName()).getItem();
        } else {
            throw new InvalidTypeException("Cannot remove properties from item of type "
                    + (item == null ? "null" : item.getClass().getSimpleName()));
        }

        for (String field : fieldNames) {
            if (!(target instanceof FieldedItem withFields) || !withFields.hasField(field)) {
                throw new ItemNotFoundException("Could not remove nonexistent field " + field + " from "
                        + target.describe());
            }
            if (target instanceof ObjectItem && ObjectItem.NAME.equals(field)) {
                throw new InvalidValueException("Cannot remove the name of " + target.describe());
            }
        }

        if (target instanceof FieldedItem fielded) {
            for (String field : fieldNames) {
                fielded.removeField(field);
            }
        }
        log.debug("Removed fields {} from {}", fieldNames, target.describe());
    }

    public void removeItem(Map<String, ?> properties) {
        removeItem(GlmItemFactory.fromProperties(properties));
    }

    /**
     * Removes the matching item from the tree and the index. Removing an
     * object also removes anything nested inside it.
     *
     * @throws ItemNotFoundException if the item does not exist or is an
     *         unnamed object
     */
    public void removeItem(GlmItem item) {
        if (item instanceof ObjectItem object) {
            if (!object.isNamed()) {
                throw new ItemNotFoundException("Cannot remove unnamed objects");
            }
            IndexEntry<ObjectItem> entry = index.getObject(object.getType(), object.getName())
                    .orElseThrow(() -> objectNotFound(object.getType(), object.getName()));
            removeSubtree(entry.getKey());
        } else if (item instanceof ClockItem) {
            IndexEntry<ClockItem> entry = index.getClock()
                    .orElseThrow(() -> new ItemNotFoundException("Clock does not exist"));
            tree.remove(entry.getKey());
            index.removeClock();
        } else if (item instanceof ModuleItem module) {
            IndexEntry<GlmItem> entry = lookupModuleEntry(module.getName());
            tree.remove(entry.getKey());
            index.removeModule(module.getName());
        } else {
            throw new InvalidTypeException("Cannot remove item of type "
                    + (item == null ? "null" : item.getClass().getSimpleName()));
        }
        log.debug("Removed {}", item.describe());
    }

    private void removeSubtree(int key) {
        GlmItem item = tree.remove(key);
        if (item == null) {
            return;
        }
        if (item.getParentKey() != null && tree.get(item.getParentKey()) instanceof FieldedItem parent) {
            parent.removeChild(key);
        }
        if (item instanceof ObjectItem object) {
            index.removeObject(key, object);
        }
        if (item instanceof FieldedItem fielded) {
            for (Integer child : new ArrayList<>(fielded.getChildren())) {
                removeSubtree(child);
            }
        }
    }

    // ---- Queries ----

    /**
     * Named objects of a type, as held by the tree. Empty when no object of
     * the type exists.
     */
    public List<ObjectItem> getObjectsByType(String objectType) {
        List<ObjectItem> result = new ArrayList<>();
        for (IndexEntry<ObjectItem> entry : index.getObjects(objectType)) {
            result.add(entry.getItem());
        }
        return result;
    }

    public Optional<ObjectItem> findObject(String objectType, String objectName) {
        return index.getObject(objectType, objectName).map(IndexEntry::getItem);
    }

    public Optional<ClockItem> findClock() {
        return index.getClock().map(IndexEntry::getItem);
    }

    public boolean objectTypePresent(String objectType) {
        if (objectType == null) {
            throw new InvalidTypeException("Object type must be text");
        }
        return index.hasObjectType(objectType);
    }

    public boolean modulePresent(String moduleName) {
        if (moduleName == null) {
            throw new InvalidTypeException("Module name must be text");
        }
        return index.hasModule(moduleName);
    }

    /**
     * Number of objects per type, unnamed ones included, in index order.
     */
    public Map<String, Integer> getObjectTypeCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String type : index.getObjectTypes()) {
            counts.put(type, index.getObjects(type).size());
        }
        for (IndexEntry<ObjectItem> unnamed : index.getUnnamedObjects()) {
            counts.merge(unnamed.getItem().getType(), 1, Integer::sum);
        }
        return counts;
    }

    // ---- Run setup ----

    /**
     * Sets clock fields. With an existing clock only the given fields are
     * overwritten; without one, all three are needed to create it.
     *
     * @throws InvalidValueException if nothing is given, if a new clock would
     *         be incomplete, or if the start is after the stop
     */
    public void addOrModifyClock(LocalDateTime starttime, LocalDateTime stoptime, String timezone) {
        if (starttime == null && stoptime == null && timezone == null) {
            throw new InvalidValueException("starttime, stoptime and timezone cannot all be absent");
        }
        if (timezone != null && timezone.isBlank()) {
            throw new InvalidValueException("timezone must not be blank");
        }
        if (starttime != null && stoptime != null && starttime.isAfter(stoptime)) {
            throw new InvalidValueException("starttime " + starttime + " is after stoptime " + stoptime);
        }

        Optional<ClockItem> existing = findClock();
        if (existing.isEmpty()) {
            if (starttime == null || stoptime == null || timezone == null) {
                throw new InvalidValueException(
                        "The model has no clock, so starttime, stoptime and timezone are all required");
            }
            ClockItem clock = new ClockItem();
            clock.putField(ClockItem.TIMEZONE, timezone);
            clock.putField(ClockItem.STARTTIME, clockTime(starttime));
            clock.putField(ClockItem.STOPTIME, clockTime(stoptime));
            addItem(clock);
            return;
        }

        ClockItem clock = existing.get();
        if (timezone != null) {
            clock.putField(ClockItem.TIMEZONE, timezone);
        }
        if (starttime != null) {
            clock.putField(ClockItem.STARTTIME, clockTime(starttime));
        }
        if (stoptime != null) {
            clock.putField(ClockItem.STOPTIME, clockTime(stoptime));
        }
        log.debug("Updated clock: {}", clock.getFields());
    }

    private static String clockTime(LocalDateTime time) {
        return "'" + CLOCK_FORMAT.format(time) + "'";
    }

    /**
     * Adds what a simulation run needs: the clock, the minimum_timestep,
     * profiler and relax_naming_rules settings, a powerflow module using the
     * NR solver with line capacitance, the generators module when
     * distributed generation is present, and a VSOURCE define when a voltage
     * is given. Existing settings of the same name are replaced. Without a
     * voltage any VSOURCE already in the model is kept. Device objects are
     * left alone.
     */
    public void addRunComponents(RunComponentsRequest request) {
        String vSource = request.getVSource() == null ? null : formatNumber(validateVSource(request.getVSource()));
        int profiler = validateProfiler(request.getProfiler());
        int minimumTimestep = validateMinimumTimestep(request.getMinimumTimestep());

        addOrModifyClock(request.getStarttime(), request.getStoptime(), request.getTimezone());

        replaceDirective(DirectiveItem.SET, MINIMUM_TIMESTEP, MINIMUM_TIMESTEP + "=" + minimumTimestep);
        replaceDirective(DirectiveItem.SET, PROFILER, PROFILER + "=" + profiler);
        replaceDirective(DirectiveItem.SET, RELAX_NAMING_RULES, RELAX_NAMING_RULES + "=1");

        if (index.hasModule(POWERFLOW)) {
            removeItem(ModuleItem.builder().name(POWERFLOW).build());
        }
        addItem(ModuleItem.builder()
                .name(POWERFLOW)
                .field("solver_method", "NR")
                .field("line_capacitance", "TRUE")
                .build());

        if (generationDetector.requiresGenerators(index) && !index.hasModule(GENERATORS)) {
            addItem(ModuleItem.builder().name(GENERATORS).build());
            log.info("Distributed generation found ({}), added generators module",
                    generationDetector.firstGenerationType(index).orElse("?"));
        }

        // The model's own VSOURCE stays unless a new one is given.
        if (vSource != null) {
            replaceDirective(DirectiveItem.DEFINE, VSOURCE, VSOURCE + "=" + vSource);
        }

        log.info("Added run components: minimum_timestep={}, profiler={}, VSOURCE={}",
                minimumTimestep, profiler, vSource != null ? vSource : "unchanged");
    }

    private Number validateVSource(Number vSource) {
        if (!Double.isFinite(vSource.doubleValue())) {
            throw new InvalidValueException("v_source must be a finite number, got " + vSource);
        }
        return vSource;
    }

    private int validateProfiler(Number profiler) {
        if (profiler == null) {
            return config.getDefaultProfiler();
        }
        if (!isIntegral(profiler)) {
            throw new InvalidTypeException("profiler must be an integer, got " + profiler.getClass().getSimpleName());
        }
        long value = profiler.longValue();
        if (value != 0 && value != 1) {
            throw new InvalidValueException("profiler must be 0 or 1, got " + value);
        }
        return (int) value;
    }

    private int validateMinimumTimestep(Number minimumTimestep) {
        if (minimumTimestep == null) {
            return config.getDefaultMinimumTimestep();
        }
        if (!isIntegral(minimumTimestep)) {
            throw new InvalidTypeException("minimum_timestep must be an integer, got "
                    + minimumTimestep.getClass().getSimpleName());
        }
        long value = minimumTimestep.longValue();
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new InvalidValueException("minimum_timestep must be a positive number of seconds, got " + value);
        }
        return (int) value;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger;
    }

    private static String formatNumber(Number number) {
        if (isIntegral(number)) {
            return number.toString();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return BigDecimal.valueOf(number.doubleValue()).toPlainString();
    }

    /**
     * Drops every top-level {@code <keyword> <variable>=...} directive, then
     * prepends a bare one with the new argument.
     */
    private void replaceDirective(String keyword, String variable, String argument) {
        List<Integer> stale = new ArrayList<>();
        for (Map.Entry<Integer, GlmItem> entry : tree.entries().entrySet()) {
            if (entry.getValue() instanceof DirectiveItem directive
                    && keyword.equals(directive.getKeyword())
                    && variable.equals(directive.getVariableName())) {
                stale.add(entry.getKey());
            }
        }
        for (Integer key : stale) {
            tree.remove(key);
        }
        addItem(DirectiveItem.bare(keyword, argument));
    }

    // ---- Output ----

    public RenderedModel renderModel() {
        RenderedModel rendered = serializer.render(tree);
        if (rendered.hasWarnings()) {
            log.warn("Model rendered with {} warning(s)", rendered.getWarnings().size());
        }
        return rendered;
    }

    /**
     * Renders the model and hands the text to storage.
     */
    public RenderedModel writeModel(Path outPath, ModelStorage storage) throws IOException {
        RenderedModel rendered = renderModel();
        storage.write(outPath, rendered.getText());
        log.info("Wrote model {} ({} items)", outPath, tree.size());
        return rendered;
    }

    // ---- Lookups ----

    private ObjectItem lookupObject(ObjectItem object) {
        if (!object.isNamed()) {
            throw new ItemNotFoundException("To find an object of type " + object.getType() + ", its name is needed");
        }
        return index.getObject(object.getType(), object.getName())
                .map(IndexEntry::getItem)
                .orElseThrow(() -> objectNotFound(object.getType(), object.getName()));
    }

    private ClockItem lookupClock() {
        return findClock().orElseThrow(() -> new ItemNotFoundException("Clock does not exist"));
    }

    private IndexEntry<GlmItem> lookupModuleEntry(String name) {
        return index.getModule(name)
                .orElseThrow(() -> new ItemNotFoundException("Module " + name + " does not exist"));
    }

    private static ItemNotFoundException objectNotFound(String type, String name) {
        return new ItemNotFoundException("Object of type " + type + " and name " + name + " does not exist");
    }
}
