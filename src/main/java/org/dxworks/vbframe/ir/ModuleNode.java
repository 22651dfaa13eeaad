package org.dxworks.vbframe.ir;

import org.dxworks.vbframe.ModuleKind;

import java.util.List;

/**
 * Root of a file's IR. Children are the module elements in source order: header statements,
 * the designer section of forms, attributes, options, declarations and procedures.
 */
public final class ModuleNode extends IrNode {

    private final ModuleKind moduleKind;
    private final String name;
    private final String version;
    private final boolean privateModule;
    private final List<String> options;

    public ModuleNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                      ModuleKind moduleKind, String name, String version, boolean privateModule,
                      List<String> options) {
        super(id, span, text, children);
        this.moduleKind = moduleKind;
        this.name = name;
        this.version = version;
        this.privateModule = privateModule;
        this.options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    public ModuleKind getModuleKind() {
        return moduleKind;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public boolean isPrivateModule() {
        return privateModule;
    }

    /**
     * Distinct module options in first-seen order, e.g. {@code explicit}, {@code compare=text}.
     */
    public List<String> getOptions() {
        return options;
    }
}
