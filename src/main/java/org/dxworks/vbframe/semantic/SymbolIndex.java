package org.dxworks.vbframe.semantic;

import org.dxworks.vbframe.ir.ControlElementNode;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrWalker;
import org.dxworks.vbframe.ir.ModuleNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Side index of one module, built once per enrichment run. Cross references in the IR are ids; this is
 * where they are resolved. Name lookups are case-insensitive, as in VB.
 */
public final class SymbolIndex {

    private final ModuleNode module;
    private final Map<String, IrNode> byId = new HashMap<>();
    private final Map<String, List<ControlElementNode>> controls = new LinkedHashMap<>();
    private final Map<String, DeclarationNode> eventSources = new HashMap<>();
    private final Set<String> userTypes = new HashSet<>();
    private ControlElementNode rootControl;

    private SymbolIndex(ModuleNode module) {
        this.module = module;
    }

    public static SymbolIndex build(ModuleNode module) {
        SymbolIndex index = new SymbolIndex(module);
        for (IrNode child : module.getChildren()) {
            if (child instanceof ControlElementNode && index.rootControl == null) {
                index.rootControl = (ControlElementNode) child;
            }
        }
        for (IrNode node : IrWalker.preorder(module)) {
            index.byId.put(node.getId(), node);
            if (node instanceof ControlElementNode) {
                ControlElementNode control = (ControlElementNode) node;
                index.controls.computeIfAbsent(key(control.getName()), k -> new ArrayList<>()).add(control);
            } else if (node instanceof DeclarationNode) {
                index.addDeclaration((DeclarationNode) node);
            }
        }
        return index;
    }

    private void addDeclaration(DeclarationNode decl) {
        switch (decl.getDeclarationKind()) {
            case TYPE:
            case ENUM:
                userTypes.add(key(decl.getName()));
                break;
            case VARIABLE:
                if (decl.hasModifier("withEvents")) {
                    eventSources.putIfAbsent(key(decl.getName()), decl);
                }
                break;
            default:
                break;
        }
    }

    public ModuleNode getModule() {
        return module;
    }

    public IrNode find(String id) {
        return byId.get(id);
    }

    /**
     * Top-level designer block of a form, or null for other modules.
     */
    public ControlElementNode getRootControl() {
        return rootControl;
    }

    /**
     * Controls declared under {@code name}, in declaration order.
     */
    public List<ControlElementNode> controlsNamed(String name) {
        List<ControlElementNode> found = controls.get(key(name));
        return found == null ? List.of() : Collections.unmodifiableList(found);
    }

    public Map<String, List<ControlElementNode>> controlsByName() {
        return Collections.unmodifiableMap(controls);
    }

    public DeclarationNode withEventsVariable(String name) {
        return eventSources.get(key(name));
    }

    /**
     * Lower-cased names of the module's {@code Type} and {@code Enum} declarations.
     */
    public Set<String> getUserTypes() {
        return Collections.unmodifiableSet(userTypes);
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
