package com.gridmodel.glm.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.gridmodel.glm.exception.DuplicateItemException;
import com.gridmodel.glm.model.ClockItem;
import com.gridmodel.glm.model.GlmItem;
import com.gridmodel.glm.model.ObjectItem;

/**
 * Lookup structure derived from a {@link com.gridmodel.glm.model.ModelTree}:
 * the clock, modules by name, named objects by type and name, and unnamed
 * objects in tree order.
 *
 * The index is never the source of truth. Entries share their item with the
 * tree, so field edits made through either are visible through both; adding
 * or removing items must update both sides together.
 */
public class ModelIndex {

    private IndexEntry<ClockItem> clock;

    /** Values are {@code ModuleItem}s or {@code module <name>;} directives. */
    private final Map<String, IndexEntry<GlmItem>> modules = new LinkedHashMap<>();

    private final Map<String, Map<String, IndexEntry<ObjectItem>>> objects = new LinkedHashMap<>();

    private final List<IndexEntry<ObjectItem>> unnamedObjects = new ArrayList<>();

    public Optional<IndexEntry<ClockItem>> getClock() {
        return Optional.ofNullable(clock);
    }

    public Optional<IndexEntry<GlmItem>> getModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public Optional<IndexEntry<ObjectItem>> getObject(String type, String name) {
        Map<String, IndexEntry<ObjectItem>> byName = objects.get(type);
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    /**
     * Named objects of a type, in the order they were indexed; empty when
     * the type is unknown.
     */
    public List<IndexEntry<ObjectItem>> getObjects(String type) {
        Map<String, IndexEntry<ObjectItem>> byName = objects.get(type);
        return byName == null ? List.of() : List.copyOf(byName.values());
    }

    public List<IndexEntry<ObjectItem>> getUnnamedObjects() {
        return Collections.unmodifiableList(unnamedObjects);
    }

    public boolean hasModule(String name) {
        return modules.containsKey(name);
    }

    /**
     * True once any object of the type, named or not, has been indexed.
     * The type stays registered after its objects are removed; use
     * {@link #hasObjects(String)} to ask whether any are still there.
     */
    public boolean hasObjectType(String type) {
        return objects.containsKey(type);
    }

    /**
     * True while at least one object of the type, named or not, is indexed.
     */
    public boolean hasObjects(String type) {
        Map<String, IndexEntry<ObjectItem>> byName = objects.get(type);
        if (byName != null && !byName.isEmpty()) {
            return true;
        }
        return unnamedObjects.stream().anyMatch(entry -> type.equals(entry.getItem().getType()));
    }

    public List<String> getObjectTypes() {
        return List.copyOf(objects.keySet());
    }

    public List<String> getModuleNames() {
        return List.copyOf(modules.keySet());
    }

    public void putClock(int key, ClockItem item) {
        if (clock != null) {
            throw new DuplicateItemException("Multiple clocks defined (keys " + clock.getKey() + " and " + key + ")");
        }
        clock = new IndexEntry<>(key, item);
    }

    public void putModule(String name, int key, GlmItem item) {
        if (modules.containsKey(name)) {
            throw new DuplicateItemException("Module " + name + " is already present");
        }
        modules.put(name, new IndexEntry<>(key, item));
    }

    /**
     * Replaces the item a module name maps to, keeping its key. Used when a
     * {@code module <name>;} directive is turned into a block module.
     */
    public void replaceModule(String name, int key, GlmItem item) {
        modules.put(name, new IndexEntry<>(key, item));
    }

    public void putObject(int key, ObjectItem item) {
        Map<String, IndexEntry<ObjectItem>> byName = objects.computeIfAbsent(item.getType(), t -> new LinkedHashMap<>());

        if (!item.isNamed()) {
            unnamedObjects.add(new IndexEntry<>(key, item));
            return;
        }
        if (byName.containsKey(item.getName())) {
            throw new DuplicateItemException(item.getName() + " already exists in the " + item.getType() + " map");
        }
        byName.put(item.getName(), new IndexEntry<>(key, item));
    }

    public void removeClock() {
        clock = null;
    }

    public void removeModule(String name) {
        modules.remove(name);
    }

    /**
     * Drops an object by key, whether it is named or not. The type stays
     * registered.
     */
    public void removeObject(int key, ObjectItem item) {
        if (item.isNamed()) {
            Map<String, IndexEntry<ObjectItem>> byName = objects.get(item.getType());
            if (byName != null) {
                byName.remove(item.getName());
            }
        } else {
            unnamedObjects.removeIf(entry -> entry.getKey() == key);
        }
    }

    /**
     * Checks, without changing anything, whether an object could be indexed.
     */
    public void checkObjectAddable(ObjectItem item) {
        if (item.isNamed() && getObject(item.getType(), item.getName()).isPresent()) {
            throw new DuplicateItemException(item.getName() + " already exists in the " + item.getType() + " map");
        }
    }
}
